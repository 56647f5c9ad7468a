package com.hornetcontrol.mission.client;

/** The mission catalog could not be reached or answered with something unusable. */
public class MissionCatalogException extends RuntimeException {
  public MissionCatalogException(String message) {
    super(message);
  }

  public MissionCatalogException(String message, Throwable cause) {
    super(message, cause);
  }
}
