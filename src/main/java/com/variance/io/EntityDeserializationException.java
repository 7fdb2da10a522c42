package com.variance.io;

import java.nio.file.Path;

/**
 * Thrown when a record file does not parse into the store's element type.
 */
public class EntityDeserializationException extends RepositoryException {

    private final Path file;

    public EntityDeserializationException(Path file, String reason, Throwable cause) {
        super("Failed to parse " + file + ": " + reason, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
