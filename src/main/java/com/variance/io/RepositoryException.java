package com.variance.io;

/**
 * Base class for failures surfaced by a repository.
 * Unchecked so that it can escape lazily evaluated streams.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
