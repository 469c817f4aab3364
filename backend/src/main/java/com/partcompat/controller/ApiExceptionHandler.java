package com.partcompat.controller;

import com.partcompat.exception.DuplicateEntryException;
import com.partcompat.exception.TenantAccessDeniedException;
import com.partcompat.exception.TransientStoreException;
import com.partcompat.exception.ValidationFailedException;
import jakarta.persistence.EntityNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Translates service exceptions into JSON error responses for all controllers.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationFailedException.class)
    public ResponseEntity<Map<String, String>> handleValidation(ValidationFailedException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", messageOrDefault(ex, "Invalid request"), "code", ex.getError().name()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", message.isEmpty() ? "Invalid request" : message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", messageOrDefault(ex, "Invalid request")));
    }

    @ExceptionHandler(DuplicateEntryException.class)
    public ResponseEntity<Map<String, String>> handleDuplicate(DuplicateEntryException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", messageOrDefault(ex, "Duplicate entry")));
    }

    @ExceptionHandler(TenantAccessDeniedException.class)
    public ResponseEntity<Map<String, String>> handleAccessDenied(TenantAccessDeniedException ex) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
            .body(Map.of("error", messageOrDefault(ex, "Access denied")));
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(EntityNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", messageOrDefault(ex, "Not found")));
    }

    @ExceptionHandler(TransientStoreException.class)
    public ResponseEntity<Map<String, String>> handleStoreFailure(TransientStoreException ex) {
        // Already logged with context by the service
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("error", "The request could not be completed. Please try again."));
    }

    private static String messageOrDefault(Exception ex, String defaultMessage) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? defaultMessage : message;
    }
}
