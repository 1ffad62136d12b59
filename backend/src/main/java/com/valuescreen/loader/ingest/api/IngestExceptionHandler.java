package com.valuescreen.loader.ingest.api;

import com.valuescreen.loader.ingest.model.IngestResult;
import com.valuescreen.loader.ingest.service.ActiveIngestionException;
import com.valuescreen.loader.ingest.service.IngestPreconditionException;
import java.time.Duration;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class IngestExceptionHandler {

  @ExceptionHandler(ActiveIngestionException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveIngestionException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_ingestion_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(IngestPreconditionException.class)
  public ResponseEntity<IngestResult> handlePrecondition(IngestPreconditionException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(IngestResult.failed(ex.getMessage(), 0, Duration.ZERO));
  }
}
