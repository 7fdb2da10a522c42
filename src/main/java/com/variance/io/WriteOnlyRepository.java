package com.variance.io;

import java.util.Objects;

/**
 * Write capability of a keyed store.
 *
 * Only consumes {@code T}, so a writer for a general type can stand in for a writer
 * of a more specific one: accept {@code WriteOnlyRepository<? super T>}, or adapt it
 * with {@link #narrow(WriteOnlyRepository)} where the exact type is required.
 *
 * @param <T> element type accepted by the store
 */
public interface WriteOnlyRepository<T> {

    /**
     * Store an entity under its ID, replacing any existing record with that ID.
     */
    void insert(T item);

    /**
     * View a writer of a {@code T} supertype as a writer of {@code T}.
     * The view exposes the insert operation only.
     */
    static <T> WriteOnlyRepository<T> narrow(WriteOnlyRepository<? super T> target) {
        Objects.requireNonNull(target, "target");
        return new WriteOnlyRepository<>() {
            @Override
            public void insert(T item) {
                target.insert(item);
            }

            @Override
            public String toString() {
                return "WriteOnly(" + target + ")";
            }
        };
    }
}
