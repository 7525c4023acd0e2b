package com.convo.backend.common.exception;

import com.convo.backend.room.service.RoomOperationException;
import com.convo.backend.room.summary.SummarizationException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  static final String CODE_PROPERTY = "code";

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("An unexpected error occurred. Please retry later.");
    problem.setProperty(CODE_PROPERTY, "INTERNAL_ERROR");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler(RoomOperationException.class)
  public ResponseEntity<ProblemDetail> handleRoomOperation(RoomOperationException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(ex.code().status());
    problem.setTitle(ex.code().title());
    problem.setDetail(ex.getMessage());
    problem.setProperty(CODE_PROPERTY, ex.code().name());
    if (ex.rejectionReason() != null) {
      problem.setProperty("reason", ex.rejectionReason().name());
    }
    return ResponseEntity.status(ex.code().status()).body(problem);
  }

  @ExceptionHandler(SummarizationException.class)
  public ResponseEntity<ProblemDetail> handleSummarization(SummarizationException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Summary unavailable");
    problem.setDetail("Failed to generate summary: " + ex.getMessage());
    problem.setProperty(CODE_PROPERTY, "GATEWAY_ERROR");
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
  }

  @ExceptionHandler({
    MethodArgumentNotValidException.class,
    BindException.class,
    HandlerMethodValidationException.class,
    ConstraintViolationException.class,
    MissingServletRequestParameterException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<ProblemDetail> handleValidationErrors(Exception ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(resolveValidationMessage(ex));
    problem.setProperty(CODE_PROPERTY, "VALIDATION_FAILED");
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  private String resolveValidationMessage(Exception ex) {
    if (ex instanceof MethodArgumentNotValidException methodArgumentNotValidException) {
      return methodArgumentNotValidException.getBindingResult().getFieldErrors().stream()
          .findFirst()
          .map(error -> error.getField() + ": " + defaultMessage(error.getDefaultMessage()))
          .orElse("Invalid request payload");
    }
    if (ex instanceof BindException bindException) {
      return bindException.getBindingResult().getAllErrors().stream()
          .findFirst()
          .map(error -> defaultMessage(error.getDefaultMessage()))
          .orElse("Invalid request payload");
    }
    if (ex instanceof MissingServletRequestParameterException missing) {
      return "Missing request parameter '" + missing.getParameterName() + "'";
    }
    if (ex instanceof ConstraintViolationException violation) {
      return violation.getConstraintViolations().stream()
          .findFirst()
          .map(v -> defaultMessage(v.getMessage()))
          .orElse("Invalid request payload");
    }
    return "Invalid request payload";
  }

  private static String defaultMessage(String message) {
    return message != null ? message : "Invalid request payload";
  }
}
