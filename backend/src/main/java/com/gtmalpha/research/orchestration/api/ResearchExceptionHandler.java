package com.gtmalpha.research.orchestration.api;

import com.gtmalpha.research.orchestration.service.ActiveResearchRunException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ResearchExceptionHandler {

  @ExceptionHandler(ActiveResearchRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveResearchRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_research_run", "message", ex.getMessage()));
  }
}
