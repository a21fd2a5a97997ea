package com.contact.resolution.alert;

/**
 * Thrown when an alert could not be delivered.
 */
public class AlertDispatchException extends RuntimeException {

    public AlertDispatchException(String message) {
        super(message);
    }

    public AlertDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
