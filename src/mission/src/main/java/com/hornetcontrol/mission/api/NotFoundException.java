package com.hornetcontrol.mission.api;

/**
 * Domain-level exception used for unknown missions and swarms.
 *
 * <p>Mapped to HTTP 404 by {@link ApiExceptionHandler}.
 */
public class NotFoundException extends RuntimeException {
  public NotFoundException(String message) {
    super(message);
  }
}
