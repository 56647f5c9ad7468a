package com.hornetcontrol.relay.model;

import com.hornetcontrol.relay.fleet.Vehicle;
import java.util.List;

/**
 * Response contract for {@code GET /api/status}.
 *
 * @param vehicles canonical vehicle states in snapshot order
 * @param simulatorConnected whether an open simulator connection is registered
 * @param observersConnected number of registered observers
 * @param timestamp response generation timestamp
 */
public record RelayStatusResponse(
    List<Vehicle> vehicles,
    boolean simulatorConnected,
    int observersConnected,
    String timestamp) {}
