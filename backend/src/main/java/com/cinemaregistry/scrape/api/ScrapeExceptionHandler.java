package com.cinemaregistry.scrape.api;

import com.cinemaregistry.scrape.service.ActiveScrapeRunException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScrapeExceptionHandler {

  @ExceptionHandler(ActiveScrapeRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveScrapeRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_scrape_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRange(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_run_config", "message", ex.getMessage()));
  }
}
