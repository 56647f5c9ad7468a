package com.hornetcontrol.mission.geometry;

import com.hornetcontrol.mission.model.Waypoint;

/**
 * Converts between geographic map coordinates and simulator meters.
 *
 * <p>Simulator x grows with latitude and y with longitude, both scaled by a fixed number of
 * degrees per meter around a base coordinate.
 */
public class CoordinateProjection {
  private final double baseLng;
  private final double baseLat;
  private final double degreesPerMeter;

  public CoordinateProjection(double baseLng, double baseLat, double degreesPerMeter) {
    if (!Double.isFinite(degreesPerMeter) || degreesPerMeter <= 0) {
      throw new IllegalArgumentException("degreesPerMeter must be positive: " + degreesPerMeter);
    }
    this.baseLng = baseLng;
    this.baseLat = baseLat;
    this.degreesPerMeter = degreesPerMeter;
  }

  /**
   * Projects a waypoint onto the simulator plane. Planar coordinates win when both are present.
   *
   * @param waypoint planar or geographic waypoint
   * @return planar position at altitude 0
   * @throws IllegalArgumentException when the waypoint carries neither coordinate pair
   */
  public Position toPlanar(Waypoint waypoint) {
    if (waypoint == null) {
      throw new IllegalArgumentException("waypoint is missing");
    }
    if (waypoint.hasPlanar()) {
      return new Position(waypoint.x(), waypoint.y(), 0.0);
    }
    if (waypoint.hasGeographic()) {
      return fromGeographic(waypoint.lng(), waypoint.lat());
    }
    throw new IllegalArgumentException("waypoint has neither planar nor geographic coordinates");
  }

  public Position fromGeographic(double lng, double lat) {
    return new Position((lat - baseLat) / degreesPerMeter, (lng - baseLng) / degreesPerMeter, 0.0);
  }

  public Waypoint toGeographic(double x, double y) {
    return Waypoint.geographic(baseLng + y * degreesPerMeter, baseLat + x * degreesPerMeter);
  }
}
