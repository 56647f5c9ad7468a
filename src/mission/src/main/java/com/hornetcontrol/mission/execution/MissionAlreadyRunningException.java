package com.hornetcontrol.mission.execution;

/**
 * Raised when a run is requested while another one is active. Nothing is dispatched and no run
 * state changes. Mapped to HTTP 409.
 */
public class MissionAlreadyRunningException extends RuntimeException {
  public MissionAlreadyRunningException(String message) {
    super(message);
  }
}
