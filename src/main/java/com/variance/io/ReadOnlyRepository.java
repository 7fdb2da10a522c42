package com.variance.io;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * Read capability of a keyed store.
 *
 * Only produces {@code T}, so a reader of a specific type can stand in for a reader
 * of a more general one: accept {@code ReadOnlyRepository<? extends T>}, or adapt it
 * with {@link #widen(ReadOnlyRepository)} where the exact type is required.
 *
 * @param <T> element type produced by the store
 */
public interface ReadOnlyRepository<T> {

    /**
     * Load a single entity by ID.
     *
     * @param id Entity ID
     * @return The entity, never null
     * @throws EntityNotFoundException if no record exists for the ID
     * @throws EntityDeserializationException if the record cannot be parsed
     */
    T get(String id);

    /**
     * Stream every stored entity in directory listing order.
     * Each call re-reads the store; the returned stream is single-use and should be closed.
     */
    Stream<T> getAll();

    /**
     * Check if an entity exists without reading it.
     */
    boolean exists(String id);

    /**
     * View a reader of {@code T} subtypes as a reader of {@code T}.
     * The view exposes read operations only.
     */
    static <T> ReadOnlyRepository<T> widen(ReadOnlyRepository<? extends T> source) {
        Objects.requireNonNull(source, "source");
        return new ReadOnlyRepository<>() {
            @Override
            public T get(String id) {
                return source.get(id);
            }

            @Override
            public Stream<T> getAll() {
                return source.getAll().map(item -> item);
            }

            @Override
            public boolean exists(String id) {
                return source.exists(id);
            }

            @Override
            public String toString() {
                return "ReadOnly(" + source + ")";
            }
        };
    }
}
