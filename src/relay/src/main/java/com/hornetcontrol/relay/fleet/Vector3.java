package com.hornetcontrol.relay.fleet;

/** Cartesian triple in simulator meters (position) or meters per second (velocity). */
public record Vector3(double x, double y, double z) {
  public static final Vector3 ZERO = new Vector3(0.0, 0.0, 0.0);
}
