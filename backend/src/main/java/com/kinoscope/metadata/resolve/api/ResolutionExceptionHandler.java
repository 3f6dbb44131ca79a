package com.kinoscope.metadata.resolve.api;

import com.kinoscope.metadata.resolve.imdb.ResolutionAbortedException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ResolutionExceptionHandler {

  @ExceptionHandler(ResolutionAbortedException.class)
  public ResponseEntity<Map<String, String>> handleAborted(ResolutionAbortedException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "resolution_aborted", "message", ex.getMessage()));
  }
}
