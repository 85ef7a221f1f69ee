package io.github.eutro.flattening.passes;

import io.github.eutro.flattening.passes.misc.ChainedPass;

/**
 * A pass over some part of the IR, which may modify it or convert it to something else.
 * <p>
 * An <i>in-place</i> pass has the same input and result types, returns its input,
 * and returns true from {@link #isInPlace()}.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    B run(A a);

    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another.
     *
     * @param next The pass to run on the result of this one.
     * @param <C>  The result type.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
