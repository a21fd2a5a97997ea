package com.contact.resolution.source;

/**
 * The system of record could not answer: unreachable, timed out or returned an error.
 */
public class SystemOfRecordException extends RuntimeException {

    public SystemOfRecordException(String message) {
        super(message);
    }

    public SystemOfRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
