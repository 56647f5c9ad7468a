package com.hornetcontrol.mission.protocol;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/** Command verbs understood by the simulator, with the params each one requires. */
public enum CommandVerb {
  ARM("arm"),
  DISARM("disarm"),
  TAKEOFF("takeoff", "altitude"),
  LAND("land"),
  GOTO("goto", "x", "y", "z"),
  ROTATE("rotate", "yaw"),
  MOVE("move", "dx", "dy", "dz");

  private final String wireName;
  private final List<String> requiredParams;

  CommandVerb(String wireName, String... requiredParams) {
    this.wireName = wireName;
    this.requiredParams = List.of(requiredParams);
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public List<String> requiredParams() {
    return requiredParams;
  }
}
