package com.voxell.auth.controller;

import com.voxell.auth.dto.ErrorResponse;
import com.voxell.auth.exception.AuthErrorCode;
import com.voxell.auth.exception.AuthException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps failures to stable HTTP responses. Raw exceptions never reach callers.
 *
 * Status codes:
 * - {@link AuthException}: the status attached to its {@link AuthErrorCode}
 * - Validation errors and unreadable bodies: 422
 * - Any other runtime failure: 500 with a generic detail
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ErrorResponse> handleAuth(AuthException e) {
        AuthErrorCode code = e.getCode();
        ResponseEntity.BodyBuilder response = ResponseEntity.status(code.getStatus());
        if (code.isRetryable()) {
            response.header("Retry-After", "1");
        }
        return response.body(new ErrorResponse(code.getDetail(), code.name()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse(detail, VALIDATION_ERROR));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("Malformed request body", VALIDATION_ERROR));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Internal server error", "INTERNAL_ERROR"));
    }
}
