package com.hornetcontrol.relay.fleet;

import java.util.List;

/** Start positions and colors of the two six-hornet swarms deployed with the simulator. */
public final class DefaultFleet {
  public static final String SWARM_1 = "SWARM-1";
  public static final String SWARM_2 = "SWARM-2";

  private DefaultFleet() {}

  public static List<Vehicle> vehicles() {
    return List.of(
        Vehicle.seeded("HORNET-1", SWARM_1, new Vector3(0, 0, 0), "#00bfff"),
        Vehicle.seeded("HORNET-2", SWARM_1, new Vector3(10, 10, 0), "#1e90ff"),
        Vehicle.seeded("HORNET-3", SWARM_1, new Vector3(20, 0, 0), "#4169e1"),
        Vehicle.seeded("HORNET-4", SWARM_1, new Vector3(10, -10, 0), "#6495ed"),
        Vehicle.seeded("HORNET-5", SWARM_1, new Vector3(-10, -10, 0), "#7b68ee"),
        Vehicle.seeded("HORNET-6", SWARM_1, new Vector3(-10, 10, 0), "#00ced1"),
        Vehicle.seeded("HORNET-7", SWARM_2, new Vector3(-50, 50, 0), "#ff0000"),
        Vehicle.seeded("HORNET-8", SWARM_2, new Vector3(-40, 60, 0), "#ff4500"),
        Vehicle.seeded("HORNET-9", SWARM_2, new Vector3(-30, 50, 0), "#ff6347"),
        Vehicle.seeded("HORNET-10", SWARM_2, new Vector3(-40, 40, 0), "#ff8c00"),
        Vehicle.seeded("HORNET-11", SWARM_2, new Vector3(-60, 40, 0), "#ffa500"),
        Vehicle.seeded("HORNET-12", SWARM_2, new Vector3(-60, 60, 0), "#ffa07a"));
  }
}
