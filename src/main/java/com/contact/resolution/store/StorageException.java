package com.contact.resolution.store;

/**
 * Thrown when the authoritative store cannot read or persist a record.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
