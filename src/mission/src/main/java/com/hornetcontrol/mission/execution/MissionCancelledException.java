package com.hornetcontrol.mission.execution;

public class MissionCancelledException extends RuntimeException {
  public MissionCancelledException(String message) {
    super(message);
  }
}
