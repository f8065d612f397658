package com.mooncell.relay.web;

import com.mooncell.relay.core.batch.BatchNotFoundException;
import com.mooncell.relay.core.batch.BatchTooLargeException;
import com.mooncell.relay.core.download.InvalidReferenceException;
import com.mooncell.relay.core.task.QueueClosedException;
import com.mooncell.relay.core.task.QueueFullException;
import com.mooncell.relay.core.task.TaskNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidReferenceException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidReference(InvalidReferenceException ex) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REFERENCE", ex.getMessage());
    }

    @ExceptionHandler(BatchTooLargeException.class)
    public ResponseEntity<Map<String, Object>> handleBatchTooLarge(BatchTooLargeException ex) {
        return error(HttpStatus.BAD_REQUEST, "BATCH_TOO_LARGE", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler({TaskNotFoundException.class, BatchNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(RuntimeException ex) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(QueueFullException.class)
    public ResponseEntity<Map<String, Object>> handleQueueFull(QueueFullException ex) {
        log.warn("Rejected submission: {}", ex.getMessage());
        return error(HttpStatus.TOO_MANY_REQUESTS, "QUEUE_FULL", ex.getMessage());
    }

    @ExceptionHandler(QueueClosedException.class)
    public ResponseEntity<Map<String, Object>> handleQueueClosed(QueueClosedException ex) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "SHUTTING_DOWN", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of("error", code, "message", message));
    }
}
