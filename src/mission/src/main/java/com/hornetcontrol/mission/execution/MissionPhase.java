package com.hornetcontrol.mission.execution;

/** Phases of a mission run, in execution order, followed by the terminal states. */
public enum MissionPhase {
  IDLE,
  TELEPORT_TO_ORIGIN,
  ARM_ALL,
  TAKEOFF_ALL,
  ASSEMBLE_FORMATION,
  TRAVERSE_WAYPOINTS,
  LAND_ALL,
  COMPLETE,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETE || this == FAILED || this == CANCELLED;
  }
}
