package com.jobmarket.etl.ingest.api;

import com.jobmarket.etl.ingest.service.ActiveIngestRunException;
import com.jobmarket.etl.ingest.service.InvalidIngestRequestException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class IngestExceptionHandler {

  @ExceptionHandler(ActiveIngestRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveIngestRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_ingest_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidIngestRequestException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidIngestRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", "request body is not a valid ingest request"));
  }
}
