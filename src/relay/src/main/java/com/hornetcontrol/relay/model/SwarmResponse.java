package com.hornetcontrol.relay.model;

import com.hornetcontrol.relay.fleet.Vehicle;
import java.util.List;

/**
 * Response contract for {@code GET /api/swarms/{swarmId}}.
 *
 * @param swarmId requested swarm
 * @param vehicles member vehicles
 * @param count number of members
 */
public record SwarmResponse(String swarmId, List<Vehicle> vehicles, int count) {}
