package com.hornetcontrol.mission.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Mission definition as served by the mission catalog.
 *
 * <p>The flight path is every trajectory's waypoints concatenated in order.
 *
 * @param id mission id
 * @param name display name
 * @param origin reposition center used before takeoff
 * @param trajectories ordered trajectories
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Mission(String id, String name, Waypoint origin, List<Trajectory> trajectories) {
  public Mission {
    trajectories = trajectories == null ? List.of() : List.copyOf(trajectories);
  }

  public List<Waypoint> path() {
    return trajectories.stream()
        .flatMap(trajectory -> trajectory.waypoints().stream())
        .toList();
  }
}
