package com.hornetcontrol.mission.api;

import com.hornetcontrol.mission.model.FleetViewResponse;
import com.hornetcontrol.mission.relay.FleetView;
import com.hornetcontrol.mission.relay.RelayConnection;
import java.time.Instant;
import java.util.ArrayList;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Exposes the orchestrator's fleet view, as last received from the relay. */
@RestController
@RequestMapping("/api")
public class FleetController {
  private final FleetView fleetView;
  private final RelayConnection relayConnection;

  public FleetController(FleetView fleetView, RelayConnection relayConnection) {
    this.fleetView = fleetView;
    this.relayConnection = relayConnection;
  }

  @GetMapping("/fleet")
  public FleetViewResponse fleet() {
    return new FleetViewResponse(
        new ArrayList<>(fleetView.snapshot().values()),
        relayConnection.isConnected(),
        Instant.now().toString());
  }
}
