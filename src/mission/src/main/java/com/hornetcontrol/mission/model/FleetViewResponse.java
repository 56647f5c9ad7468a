package com.hornetcontrol.mission.model;

import com.hornetcontrol.mission.relay.VehicleSnapshot;
import java.util.List;

/** Response contract for {@code GET /api/fleet}. */
public record FleetViewResponse(List<VehicleSnapshot> vehicles, boolean relayConnected, String timestamp) {}
