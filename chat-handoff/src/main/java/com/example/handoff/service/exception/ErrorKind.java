package com.example.handoff.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable failure categories surfaced to callers.
 */
public enum ErrorKind {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_TRANSITION(HttpStatus.CONFLICT),
    ALREADY_CLAIMED(HttpStatus.CONFLICT),
    ALREADY_QUEUED(HttpStatus.CONFLICT),
    DUPLICATE_SESSION(HttpStatus.CONFLICT),
    OPERATOR_AT_CAPACITY(HttpStatus.TOO_MANY_REQUESTS),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
