package com.abroadhelper.resources.api;

import com.abroadhelper.resources.service.ResourceStoreUnavailableException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ResourceExceptionHandler {

  @ExceptionHandler(ResourceStoreUnavailableException.class)
  public ResponseEntity<Map<String, String>> handleStoreUnavailable(ResourceStoreUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "store_unavailable", "message", ex.getMessage()));
  }
}
