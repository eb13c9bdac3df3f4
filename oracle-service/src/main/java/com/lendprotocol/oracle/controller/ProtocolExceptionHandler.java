package com.lendprotocol.oracle.controller;

import com.lendprotocol.common.exception.ProtocolError;
import com.lendprotocol.common.exception.ProtocolException;
import com.lendprotocol.oracle.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Translates engine error codes into HTTP statuses.
 */
@RestControllerAdvice
public class ProtocolExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ProtocolExceptionHandler.class);

    @ExceptionHandler(ProtocolException.class)
    public ResponseEntity<ErrorResponse> handleProtocol(ProtocolException e) {
        HttpStatus status = statusOf(e.getError());
        log.warn("Request rejected. error={} status={} message={}", e.getError(), status.value(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(e.getError().name(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Request rejected. error=INVALID_ARGUMENT message={}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_ARGUMENT", e.getMessage()));
    }

    static HttpStatus statusOf(ProtocolError error) {
        return switch (error) {
            case UNAUTHORIZED         -> HttpStatus.FORBIDDEN;
            case INVALID_AMOUNT       -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND            -> HttpStatus.NOT_FOUND;
            case EXTERNAL_CALL_FAILED -> HttpStatus.BAD_GATEWAY;
            case REENTRANT_CALL       -> HttpStatus.CONFLICT;
        };
    }
}
