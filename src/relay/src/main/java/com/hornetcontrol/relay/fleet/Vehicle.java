package com.hornetcontrol.relay.fleet;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Typed read view of one vehicle in the canonical snapshot.
 *
 * <p>The snapshot itself is kept as JSON so that merges can replace top-level fields exactly as
 * the simulator sent them; this record is what REST consumers and swarm filters read.
 *
 * @param id unique vehicle id
 * @param swarm swarm id, {@code null} when unassigned
 * @param position position in simulator meters
 * @param velocity velocity in meters per second
 * @param orientation attitude in degrees
 * @param battery battery percent
 * @param status flight status
 * @param armed armed flag
 * @param color display color
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Vehicle(
    String id,
    String swarm,
    Vector3 position,
    Vector3 velocity,
    Orientation orientation,
    Double battery,
    VehicleStatus status,
    Boolean armed,
    String color) {

  /** Template used when a vehicle is first seen in telemetry. */
  public static Vehicle defaults(String id) {
    return seeded(id, null, Vector3.ZERO, null);
  }

  static Vehicle seeded(String id, String swarm, Vector3 position, String color) {
    return new Vehicle(
        id,
        swarm,
        position,
        Vector3.ZERO,
        Orientation.LEVEL,
        100.0,
        VehicleStatus.IDLE,
        false,
        color);
  }
}
