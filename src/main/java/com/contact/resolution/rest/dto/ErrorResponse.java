package com.contact.resolution.rest.dto;

import java.time.Instant;

/**
 * Error body returned by the admin API.
 *
 * @param timestamp ISO-8601 instant the error was produced
 */
public record ErrorResponse(int status, String error, String message, String path, String timestamp) {

    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now().toString());
    }

    public static ErrorResponse badRequest(String message, String path) {
        return new ErrorResponse(400, "Bad Request", message, path);
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", message, path);
    }
}
