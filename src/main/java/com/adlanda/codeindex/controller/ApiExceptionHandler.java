package com.adlanda.codeindex.controller;

import com.adlanda.codeindex.exception.CollaboratorUnavailableException;
import com.adlanda.codeindex.exception.DimensionException;
import com.adlanda.codeindex.exception.EmbeddingProviderException;
import com.adlanda.codeindex.exception.NotConnectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions to HTTP statuses with a {@code {status: "error", message}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotConnectedException.class)
    public ResponseEntity<Map<String, Object>> handleNotConnected(NotConnectedException e) {
        return error(HttpStatus.UNAUTHORIZED, e.getMessage());
    }

    @ExceptionHandler(DimensionException.class)
    public ResponseEntity<Map<String, Object>> handleDimension(DimensionException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    @ExceptionHandler(CollaboratorUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleCollaborator(CollaboratorUnavailableException e) {
        log.warn("Upstream failure: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(EmbeddingProviderException.class)
    public ResponseEntity<Map<String, Object>> handleEmbedding(EmbeddingProviderException e) {
        log.warn("Embedding provider failure: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, message.isEmpty() ? "Invalid request" : message);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidParameter(HandlerMethodValidationException e) {
        return error(HttpStatus.BAD_REQUEST, "Invalid request parameter");
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("status", "error", "message", message != null ? message : status.getReasonPhrase()));
    }
}
