package com.numbersgame.puzzleserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Maps request-level failures to {@code {"detail": ...}} bodies. Problems with a player's
 * expression never reach this class; they are part of a normal check response.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidParameterException.class)
    public ResponseEntity<Map<String, String>> handleInvalidParameter(InvalidParameterException e) {
        return detail(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleMalformedRequest(Exception e) {
        return detail(HttpStatus.BAD_REQUEST, "Malformed request: " + e.getMessage());
    }

    @ExceptionHandler(RoundNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleRoundNotFound(RoundNotFoundException e) {
        return detail(HttpStatus.NOT_FOUND, "Round not found");
    }

    @ExceptionHandler(GenerationExhaustedException.class)
    public ResponseEntity<Map<String, String>> handleGenerationExhausted(GenerationExhaustedException e) {
        log.warn("Generation failed after {} attempt(s), cancelled={}", e.getAttempts(), e.isCancelled());
        return detail(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> detail(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("detail", message));
    }
}
