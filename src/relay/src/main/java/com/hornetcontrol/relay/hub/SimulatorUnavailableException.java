package com.hornetcontrol.relay.hub;

/**
 * Raised when a command cannot be relayed because no open simulator connection is registered.
 *
 * <p>Mapped to HTTP 503 by the REST error handler.
 */
public class SimulatorUnavailableException extends RuntimeException {
  public SimulatorUnavailableException(String message) {
    super(message);
  }

  public SimulatorUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
