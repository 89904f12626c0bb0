package com.delta.domaincheck.check.api;

import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class DomainCheckExceptionHandler {

  @ExceptionHandler(InvalidCheckRequestException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidCheckRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_check_request", "message", ex.getMessage()));
  }
}
