package com.incidentradar.analytics.api;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Centralized REST exception mapping for analytics API endpoints.
 *
 * <p>Known domain and backend exceptions are converted into stable JSON error payloads.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  /**
   * Maps filter and parameter validation errors to HTTP 400.
   *
   * @param ex validation exception with field-level violations
   * @return standardized error payload with a {@code violations} list
   */
  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
    List<Map<String, String>> violations = ex.getViolations().stream()
        .map(violation -> Map.of("field", violation.field(), "reason", violation.reason()))
        .toList();
    return ResponseEntity.badRequest().body(Map.of(
        "error", "validation_failed",
        "message", ex.getMessage(),
        "violations", violations,
        "timestamp", Instant.now().toString()));
  }

  /**
   * Maps unreadable request bodies to HTTP 400.
   *
   * @param ex body conversion failure
   * @return standardized error payload
   */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.badRequest().body(error("validation_failed", "malformed request body"));
  }

  /**
   * Maps unregistered identifier prefixes to HTTP 400.
   *
   * @param ex unknown source kind exception
   * @return standardized error payload
   */
  @ExceptionHandler(UnknownSourceKindException.class)
  public ResponseEntity<Map<String, Object>> handleUnknownSource(UnknownSourceKindException ex) {
    return ResponseEntity.badRequest().body(error("unknown_source_kind", ex.getMessage()));
  }

  /**
   * Maps missing records to HTTP 404.
   *
   * @param ex missing-resource exception
   * @return standardized error payload
   */
  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_found", ex.getMessage()));
  }

  @ExceptionHandler(AssignmentNotPendingException.class)
  public ResponseEntity<Map<String, Object>> handleNotPending(AssignmentNotPendingException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(error("not_found_or_already_complete", ex.getMessage()));
  }

  /**
   * Maps unmatched routes to HTTP 404 instead of generic 500.
   *
   * @param ex Spring MVC no-resource/no-handler exception
   * @return standardized not-found payload
   */
  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<Map<String, Object>> handleMissingRoute(Exception ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(error("not_found", "resource not found"));
  }

  /**
   * Maps connectivity failures and timeouts to HTTP 503 so callers may retry.
   *
   * @param ex retryable data access failure
   * @return standardized error payload
   */
  @ExceptionHandler({DataAccessResourceFailureException.class, TransientDataAccessException.class})
  public ResponseEntity<Map<String, Object>> handleUnavailable(DataAccessException ex) {
    log.warn("Incident database unavailable: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(error("database_unavailable", "incident database unavailable"));
  }

  /**
   * Maps other database failures to HTTP 502.
   *
   * @param ex backend data access failure
   * @return standardized error payload
   */
  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<Map<String, Object>> handleDataAccess(DataAccessException ex) {
    log.error("Incident database error", ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(error("backend_error", "incident database error"));
  }

  /**
   * Maps unexpected failures to HTTP 500.
   *
   * @param ex unhandled server-side exception
   * @return standardized error payload
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
    log.error("Unhandled API failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(error("internal_error", "internal server error"));
  }

  private Map<String, Object> error(String code, String message) {
    return Map.of(
        "error", code,
        "message", message,
        "timestamp", Instant.now().toString());
  }
}
