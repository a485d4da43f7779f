package com.siteaudit.scan.api;

import com.siteaudit.scan.service.ScanValidationException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScanExceptionHandler {

  @ExceptionHandler(ScanValidationException.class)
  public ResponseEntity<Map<String, String>> handleInvalidUrl(ScanValidationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_url", "message", ex.getMessage()));
  }

  @ExceptionHandler(ScanNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(ScanNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "scan_not_found", "message", ex.getMessage()));
  }
}
