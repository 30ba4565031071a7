package com.tarantula.crawl.api;

import com.tarantula.crawl.service.InvalidRunConfigException;
import com.tarantula.crawl.service.RunNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(InvalidRunConfigException.class)
  public ResponseEntity<Map<String, String>> handleInvalidConfig(InvalidRunConfigException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_run_config", "message", ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_run_config", "message", "request body is not valid JSON"));
  }

  @ExceptionHandler(RunNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleRunNotFound(RunNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "run_not_found", "run_id", ex.getRunId()));
  }
}
