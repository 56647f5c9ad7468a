package com.hornetcontrol.relay.fleet;

/** Attitude angles in degrees. */
public record Orientation(double pitch, double roll, double yaw) {
  public static final Orientation LEVEL = new Orientation(0.0, 0.0, 0.0);
}
