package com.hornetcontrol.mission.geometry;

/** Point in simulator meters: x north, y east, z altitude. */
public record Position(double x, double y, double z) {

  public Position withZ(double altitude) {
    return new Position(x, y, altitude);
  }

  /** Horizontal distance, ignoring altitude. */
  public double planarDistanceTo(Position other) {
    return Math.hypot(other.x - x, other.y - y);
  }
}
