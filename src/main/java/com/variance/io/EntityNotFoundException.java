package com.variance.io;

import java.nio.file.Path;

public class EntityNotFoundException extends RepositoryException {

    private final String id;
    private final Path file;

    public EntityNotFoundException(String id, Path file) {
        super("No entity with id '" + id + "' at " + file);
        this.id = id;
        this.file = file;
    }

    public String getId() {
        return id;
    }

    public Path getFile() {
        return file;
    }
}
