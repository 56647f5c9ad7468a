package com.hornetcontrol.mission.api;

import com.hornetcontrol.mission.client.MissionCatalogException;
import com.hornetcontrol.mission.execution.MissionAlreadyRunningException;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Centralized REST exception mapping for mission API endpoints.
 *
 * <p>Known domain exceptions are converted into stable JSON error payloads.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  /**
   * Maps malformed payloads and invalid requests to HTTP 400.
   *
   * @param ex exception raised while reading or validating the request
   * @return standardized error payload
   */
  @ExceptionHandler({BadRequestException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
    return ResponseEntity.badRequest().body(error("bad_request", ex.getMessage()));
  }

  /**
   * Maps unknown resources to HTTP 404.
   *
   * @param ex missing-resource exception
   * @return standardized error payload
   */
  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_found", ex.getMessage()));
  }

  /**
   * Maps a run that is already active, or a cancel with nothing to cancel, to HTTP 409.
   *
   * @param ex reentrancy or state conflict
   * @return standardized error payload
   */
  @ExceptionHandler({MissionAlreadyRunningException.class, ConflictException.class})
  public ResponseEntity<Map<String, Object>> handleConflict(RuntimeException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT).body(error("conflict", ex.getMessage()));
  }

  /**
   * Maps mission catalog failures to HTTP 502.
   *
   * @param ex catalog transport or status failure
   * @return standardized error payload
   */
  @ExceptionHandler(MissionCatalogException.class)
  public ResponseEntity<Map<String, Object>> handleCatalogFailure(MissionCatalogException ex) {
    log.warn("Mission catalog failure: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error("bad_gateway", ex.getMessage()));
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
   * Maps unexpected failures to HTTP 500.
   *
   * @param ex unhandled server-side exception
   * @return standardized error payload
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
    log.error("Unhandled mission API error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(error("internal_error", "internal server error"));
  }

  private Map<String, Object> error(String code, String message) {
    return Map.of(
        "error", code,
        "message", message == null ? code : message,
        "timestamp", Instant.now().toString());
  }
}
