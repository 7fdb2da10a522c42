package com.variance.io;

import com.variance.model.Identifiable;

/**
 * Combined read and write access to a keyed store.
 *
 * Being both producer and consumer of {@code T}, it admits no substitution in either
 * direction. Callers that only read or only write should take the narrower interface.
 *
 * @param <T> Entity type that implements Identifiable
 */
public interface Repository<T extends Identifiable> extends ReadOnlyRepository<T>, WriteOnlyRepository<T> {
}
