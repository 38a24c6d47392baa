package com.candor.api.config;

import com.candor.core.exception.AuthorizationException;
import com.candor.core.exception.CaseException;
import com.candor.core.exception.ProofVerificationException;
import com.candor.core.exception.StateException;
import com.candor.core.exception.TimeoutNotReachedException;
import com.candor.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps case workflow rejections to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String BAD_REQUEST_CODE = "CASE_400";

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ErrorResponse> handleAuthorization(AuthorizationException e) {
        return respond(HttpStatus.FORBIDDEN, e);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler({StateException.class, TimeoutNotReachedException.class})
    public ResponseEntity<ErrorResponse> handleConflict(CaseException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(ProofVerificationException.class)
    public ResponseEntity<ErrorResponse> handleProof(ProofVerificationException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(new ErrorResponse(BAD_REQUEST_CODE, message, Instant.now()));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e) {
        log.debug("Malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(BAD_REQUEST_CODE, e.getMessage(), Instant.now()));
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, CaseException e) {
        log.debug("Rejected with {}: {}", e.code(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(e.code(), e.getMessage(), Instant.now()));
    }

    public record ErrorResponse(String code, String message, Instant timestamp) {}
}
