package com.variance.io;

import java.io.IOException;

public class RepositoryIoException extends RepositoryException {

    public RepositoryIoException(String message, IOException cause) {
        super(message + ": " + cause.getMessage(), cause);
    }
}
