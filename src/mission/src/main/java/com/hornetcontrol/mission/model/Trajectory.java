package com.hornetcontrol.mission.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Trajectory(List<Waypoint> waypoints) {
  public Trajectory {
    waypoints = waypoints == null ? List.of() : List.copyOf(waypoints);
  }
}
