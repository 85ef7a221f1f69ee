package io.github.eutro.flattening.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key under which a value can be stored in an {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation, so the order of two exts may differ
 * between program executions.
 *
 * @param <T> The type of the value.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * Classes cannot name generic types, so {@code type} may be a raw supertype of {@code R};
     * it is only kept for debugging.
     *
     * @param type The most specific class of the value.
     * @param name The name of the ext, for debugging.
     * @param <T>  The class type.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getName();
    }
}
