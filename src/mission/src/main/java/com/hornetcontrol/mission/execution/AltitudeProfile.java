package com.hornetcontrol.mission.execution;

/** Linear descent from the initial altitude at the first waypoint to ground at the last. */
public final class AltitudeProfile {
  private AltitudeProfile() {}

  /**
   * @param initialAltitude altitude A at waypoint 0
   * @param index waypoint index, {@code 0 <= index < count}
   * @param count number of waypoints on the path
   * @return {@code A * (1 - index / (count - 1))}, or A for a single-waypoint path
   */
  public static double altitudeAt(double initialAltitude, int index, int count) {
    if (count <= 0 || index < 0 || index >= count) {
      throw new IllegalArgumentException("waypoint index " + index + " outside path of " + count);
    }
    if (count == 1) {
      return initialAltitude;
    }
    return initialAltitude * (1.0 - (double) index / (count - 1));
  }
}
