package com.hornetcontrol.mission.client;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of {@code POST /api/reset-positions}. Exactly one form is populated: a circle around a
 * center, a single vehicle, or a whole swarm.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RepositionRequest(Double centerX, Double centerY, Double radius, String uavId, String swarmId) {

  public static RepositionRequest circle(double centerX, double centerY, double radius) {
    return new RepositionRequest(centerX, centerY, radius, null, null);
  }

  public static RepositionRequest vehicle(String uavId) {
    return new RepositionRequest(null, null, null, uavId, null);
  }

  public static RepositionRequest swarm(String swarmId) {
    return new RepositionRequest(null, null, null, null, swarmId);
  }
}
