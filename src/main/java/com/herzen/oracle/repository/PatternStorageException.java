package com.herzen.oracle.repository;

public class PatternStorageException extends RuntimeException {
    public PatternStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
