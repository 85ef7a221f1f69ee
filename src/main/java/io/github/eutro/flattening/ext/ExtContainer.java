package io.github.eutro.flattening.ext;

import org.jetbrains.annotations.Nullable;

/**
 * Something {@link Ext}s can be attached to.
 *
 * @see io.github.eutro.flattening.ext
 */
public interface ExtContainer {
    /**
     * Associate {@code ext} with {@code value} in this container.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value of {@code ext} from this container, if any.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container, or null.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, or null if absent.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container, failing if it is absent.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     * @throws IllegalStateException If the ext is not present.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T nullable = getNullable(ext);
        if (nullable != null) return nullable;
        throw new IllegalStateException(String.format("ext not present: %s\n  in: %s", ext, this));
    }
}
