package com.delta.jobimporter.ingest.api;

import com.delta.jobimporter.ingest.run.ImportRunNotFoundException;
import com.delta.jobimporter.ingest.service.ImportFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ImportExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ImportExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "invalid_request", "message", message(ex)));
    }

    @ExceptionHandler(ImportRunNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(ImportRunNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", "import_run_not_found", "message", message(ex)));
    }

    @ExceptionHandler(ImportFailedException.class)
    public ResponseEntity<Map<String, String>> handleImportFailed(ImportFailedException ex) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of("error", "import_failed", "message", message(ex)));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, String>> handleStoreError(DataAccessException ex) {
        log.error("Store error while serving request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of("error", "store_error", "message", message(ex)));
    }

    private String message(Exception ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }
}
