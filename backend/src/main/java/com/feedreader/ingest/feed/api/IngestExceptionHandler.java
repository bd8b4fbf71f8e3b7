package com.feedreader.ingest.feed.api;

import com.feedreader.ingest.feed.service.InvalidFetchRequestException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class IngestExceptionHandler {

  @ExceptionHandler(InvalidFetchRequestException.class)
  public ResponseEntity<Map<String, String>> handleInvalidFetch(InvalidFetchRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", ex.getMessage()));
  }
}
