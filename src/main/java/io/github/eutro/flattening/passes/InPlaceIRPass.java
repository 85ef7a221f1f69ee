package io.github.eutro.flattening.passes;

/**
 * An IR pass which modifies its input and returns it.
 *
 * @param <T> The type of IR this pass operates on.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }
}
