package com.example.handoff.service.exception;

import com.example.handoff.domain.ConversationStatus;
import org.springframework.http.HttpStatus;

public class ServiceException extends RuntimeException {

    private final ErrorKind kind;
    private final ConversationStatus currentStatus;

    public ServiceException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public ServiceException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public ServiceException(ErrorKind kind, String message, ConversationStatus currentStatus) {
        this(kind, message, currentStatus, null);
    }

    public ServiceException(ErrorKind kind, String message, ConversationStatus currentStatus, Throwable cause) {
        super(message, cause, false, kind.getStatus().is5xxServerError());
        this.kind = kind;
        this.currentStatus = currentStatus;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public HttpStatus getStatus() {
        return kind.getStatus();
    }

    public String getErrorCode() {
        return kind.name();
    }

    /**
     * The conversation's true status at the time of failure, so a client can resynchronize.
     */
    public ConversationStatus getCurrentStatus() {
        return currentStatus;
    }
}
