package com.hornetcontrol.relay.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.hornetcontrol.relay.fleet.FleetState;
import com.hornetcontrol.relay.fleet.Vehicle;
import com.hornetcontrol.relay.hub.StateSyncHub;
import com.hornetcontrol.relay.model.CommandAckResponse;
import com.hornetcontrol.relay.model.RelayStatusResponse;
import com.hornetcontrol.relay.model.SwarmResponse;
import java.time.Instant;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing relay status and a command entry point for non-socket clients.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /api/status}: canonical snapshot plus connection counts</li>
 *   <li>{@code GET /api/swarms/{swarmId}}: vehicles filtered by swarm id</li>
 *   <li>{@code POST /api/command}: relays one command envelope to the simulator</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class RelayStatusController {
  private final StateSyncHub hub;
  private final FleetState fleetState;

  public RelayStatusController(StateSyncHub hub, FleetState fleetState) {
    this.hub = hub;
    this.fleetState = fleetState;
  }

  @GetMapping("/status")
  public RelayStatusResponse status() {
    return new RelayStatusResponse(
        fleetState.vehicles(),
        hub.isSimulatorConnected(),
        hub.observerCount(),
        Instant.now().toString());
  }

  /**
   * Returns the members of one swarm.
   *
   * @param swarmId swarm identifier, for example {@code SWARM-1}
   * @return swarm members
   */
  @GetMapping("/swarms/{swarmId}")
  public SwarmResponse swarm(@PathVariable("swarmId") String swarmId) {
    List<Vehicle> members = fleetState.swarm(swarmId);
    if (members.isEmpty()) {
      throw new NotFoundException("swarm not found: " + swarmId);
    }
    return new SwarmResponse(swarmId, members, members.size());
  }

  /**
   * Relays a command envelope to the simulator.
   *
   * @param command envelope with an explicit {@code targetId}
   * @return acknowledgement once the frame was handed to the simulator connection
   */
  @PostMapping("/command")
  public CommandAckResponse command(@RequestBody JsonNode command) {
    hub.relayCommand(command);
    return new CommandAckResponse(true, "Command sent to " + command.path("targetId").asText());
  }
}
