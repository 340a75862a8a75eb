package com.entity.canonical.rest.dto;

import java.time.Instant;

/**
 * Error body of the canonicalization endpoints. {@code code} tells callers
 * apart the causes that share an HTTP status, such as the two kinds of 409.
 */
public record ErrorResponse(
        int status,
        String code,
        String message,
        String path,
        Instant timestamp
) {

    public enum Code {
        INVALID_REQUEST(400),
        INDEX_NOT_FOUND(404),
        DUPLICATE_IDENTIFIER(409),
        FIT_IN_PROGRESS(409),
        INTERNAL(500),
        BACKEND_UNAVAILABLE(503);

        private final int status;

        Code(int status) {
            this.status = status;
        }

        public int status() {
            return status;
        }
    }

    public static ErrorResponse of(Code code, String message, String path) {
        return new ErrorResponse(code.status(), code.name(), message, path, Instant.now());
    }
}
