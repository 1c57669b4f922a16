package com.example.retrain;

import com.example.retrain.store.SampleValidationException;
import com.example.retrain.store.StorageCorruptedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SampleValidationException.class)
    public ResponseEntity<Map<String,Object>> invalidSample(SampleValidationException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "Invalid training sample", "violations", ex.violations()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String,Object>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(NoCurrentModelException.class)
    public ResponseEntity<Map<String,Object>> noModel(NoCurrentModelException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(StorageCorruptedException.class)
    public ResponseEntity<Map<String,Object>> corrupted(StorageCorruptedException ex) {
        log.error("Pipeline storage is unreadable", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Pipeline storage is unreadable"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String,Object>> unprocessable(Exception ex) {
        // Don’t leak internals; log it and return a generic message
        log.warn("Request failed: {}", ex.toString());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of("error", "Unable to process request"));
    }
}
