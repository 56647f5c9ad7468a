package com.hornetcontrol.mission.execution;

/**
 * Unrecoverable error inside a mission run. Ends the run in {@link MissionPhase#FAILED} with the
 * message surfaced to the caller.
 */
public class MissionAbortException extends RuntimeException {
  public MissionAbortException(String message) {
    super(message);
  }

  public MissionAbortException(String message, Throwable cause) {
    super(message, cause);
  }
}
