package com.infraops.orchestrator.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(OrchestratorException.class)
  public ResponseEntity<ProblemDetail> handleOrchestratorException(OrchestratorException ex) {
    HttpStatus status = ex.status();
    if (status.is5xxServerError()) {
      log.warn("{}: {}", ex.title(), ex.getMessage());
    } else {
      log.debug("{}: {}", ex.title(), ex.getMessage());
    }
    ProblemDetail problem = ProblemDetail.forStatus(status);
    problem.setTitle(ex.title());
    problem.setDetail(ex.getMessage());
    ex.details().forEach(problem::setProperty);
    return ResponseEntity.status(status).body(problem);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid request");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid request");
    problem.setDetail("Request body is missing or is not valid JSON");
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("An unexpected error occurred. Please retry the request later.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
  public ResponseEntity<ProblemDetail> handleValidationErrors(Exception ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(resolveValidationMessage(ex));
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  private String resolveValidationMessage(Exception ex) {
    if (ex instanceof BindException bindException) {
      return bindException
          .getBindingResult()
          .getAllErrors()
          .stream()
          .findFirst()
          .map(error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid request payload")
          .orElse("Invalid request payload");
    }
    return "Invalid request payload";
  }
}
