package com.project.thermal.hotspots.exceptions;

/** Failure while persisting uploads or generated artifacts. */
public class StorageException extends RuntimeException {
    public StorageException(String message) { super(message); }
    public StorageException(String message, Throwable cause) { super(message, cause); }
}
