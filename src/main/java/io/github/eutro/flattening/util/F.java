package io.github.eutro.flattening.util;

/**
 * A unary function. Equivalent to {@link java.util.function.Function}, but
 * doesn't collide with {@link io.github.eutro.flattening.ssa.Function}.
 *
 * @param <A> The argument type.
 * @param <B> The return type.
 */
@FunctionalInterface
public interface F<A, B> {
    B apply(A a);
}
