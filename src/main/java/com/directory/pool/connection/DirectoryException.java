package com.directory.pool.connection;

/**
 * Runtime exception for directory client setup failures, such as an unreadable
 * trust anchor file.
 */
public class DirectoryException extends RuntimeException {

    public DirectoryException(String message) {
        super(message);
    }

    public DirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
