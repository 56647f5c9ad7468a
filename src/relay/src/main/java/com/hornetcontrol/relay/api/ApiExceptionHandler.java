package com.hornetcontrol.relay.api;

import com.hornetcontrol.relay.hub.SimulatorUnavailableException;
import com.hornetcontrol.relay.protocol.ProtocolException;
import java.time.Instant;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Centralized REST exception mapping for relay API endpoints.
 *
 * <p>Known domain exceptions are converted into stable JSON error payloads.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  /**
   * Maps malformed payloads and invalid requests to HTTP 400.
   *
   * @param ex exception raised while reading or validating the request
   * @return standardized error payload
   */
  @ExceptionHandler({ProtocolException.class, HttpMessageNotReadableException.class})
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
   * Maps a missing simulator to HTTP 503.
   *
   * @param ex simulator availability failure
   * @return error payload with {@code success=false}
   */
  @ExceptionHandler(SimulatorUnavailableException.class)
  public ResponseEntity<Map<String, Object>> handleSimulatorUnavailable(SimulatorUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of(
            "success", false,
            "error", "simulator_unavailable",
            "message", ex.getMessage(),
            "timestamp", Instant.now().toString()));
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
