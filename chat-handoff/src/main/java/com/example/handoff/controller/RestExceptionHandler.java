package com.example.handoff.controller;

import com.example.handoff.service.exception.ErrorKind;
import com.example.handoff.service.exception.ServiceException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class RestExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(ServiceException.class)
    public ResponseEntity<Map<String, Object>> handleServiceException(ServiceException ex) {
        Map<String, Object> payload = body(ex.getMessage(), ex.getErrorCode());
        if (ex.getCurrentStatus() != null) {
            payload.put("currentStatus", ex.getCurrentStatus());
        }
        if (ex.getStatus().is5xxServerError()) {
            log.error("Request failed: {}", ex.getMessage(), ex);
        }
        return ResponseEntity.status(ex.getStatus()).body(payload);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        Map<String, Object> payload = body("validation_error", ErrorKind.INVALID_REQUEST.name());
        payload.put("details", details);
        return ResponseEntity.status(ErrorKind.INVALID_REQUEST.getStatus()).body(payload);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
        return ResponseEntity.status(ErrorKind.INVALID_REQUEST.getStatus())
                .body(body("Malformed request", ErrorKind.INVALID_REQUEST.name()));
    }

    @ExceptionHandler({
        TransientDataAccessException.class,
        DataAccessResourceFailureException.class,
        CannotCreateTransactionException.class
    })
    public ResponseEntity<Map<String, Object>> handleStoreUnavailable(Exception ex) {
        log.warn("Persistent store unavailable: {}", ex.getMessage());
        return ResponseEntity.status(ErrorKind.STORE_UNAVAILABLE.getStatus())
                .body(body("Store temporarily unavailable, retry the request", ErrorKind.STORE_UNAVAILABLE.name()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(body(ex.getMessage(), "HTTP_" + errorResponse.getStatusCode().value()));
        }
        log.error("Unhandled error", ex);
        return ResponseEntity.internalServerError().body(body("internal_error", "INTERNAL_ERROR"));
    }

    private Map<String, Object> body(String error, String code) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", Instant.now(clock).toString());
        payload.put("error", error);
        payload.put("code", code);
        return payload;
    }
}
