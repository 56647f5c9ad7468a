package com.hornetcontrol.mission.api;

/** Request clashes with the current run state; mapped to HTTP 409. */
public class ConflictException extends RuntimeException {
  public ConflictException(String message) {
    super(message);
  }
}
