package com.hornetcontrol.relay.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.hornetcontrol.relay.fleet.DefaultFleet;
import com.hornetcontrol.relay.fleet.FleetState;
import com.hornetcontrol.relay.fleet.Vehicle;
import com.hornetcontrol.relay.hub.SimulatorUnavailableException;
import com.hornetcontrol.relay.hub.StateSyncHub;
import com.hornetcontrol.relay.protocol.ProtocolException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = RelayStatusController.class)
class RelayStatusControllerTest {
  private static final String ARM =
      "{\"type\":\"command\",\"command\":\"arm\",\"params\":{},\"targetId\":\"HORNET-1\",\"timestamp\":1}";

  @Autowired private MockMvc mockMvc;

  @MockBean private StateSyncHub hub;
  @MockBean private FleetState fleetState;

  @Test
  void status_returnsSnapshotAndConnectionCounts() throws Exception {
    when(fleetState.vehicles()).thenReturn(DefaultFleet.vehicles());
    when(hub.isSimulatorConnected()).thenReturn(true);
    when(hub.observerCount()).thenReturn(2);

    mockMvc.perform(get("/api/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.vehicles.length()").value(12))
        .andExpect(jsonPath("$.vehicles[0].id").value("HORNET-1"))
        .andExpect(jsonPath("$.vehicles[0].status").value("idle"))
        .andExpect(jsonPath("$.simulatorConnected").value(true))
        .andExpect(jsonPath("$.observersConnected").value(2));
  }

  @Test
  void swarm_returnsMembers() throws Exception {
    List<Vehicle> members = DefaultFleet.vehicles().subList(6, 12);
    when(fleetState.swarm("SWARM-2")).thenReturn(members);

    mockMvc.perform(get("/api/swarms/SWARM-2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.swarmId").value("SWARM-2"))
        .andExpect(jsonPath("$.count").value(6))
        .andExpect(jsonPath("$.vehicles[0].id").value("HORNET-7"));
  }

  @Test
  void swarm_unknownReturns404() throws Exception {
    when(fleetState.swarm("SWARM-9")).thenReturn(List.of());

    mockMvc.perform(get("/api/swarms/SWARM-9"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("not_found"));
  }

  @Test
  void command_relaysEnvelope() throws Exception {
    mockMvc.perform(post("/api/command").contentType(MediaType.APPLICATION_JSON).content(ARM))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.message").value("Command sent to HORNET-1"));

    verify(hub).relayCommand(any(JsonNode.class));
  }

  @Test
  void command_withoutSimulatorReturns503() throws Exception {
    doThrow(new SimulatorUnavailableException("simulator not connected"))
        .when(hub).relayCommand(any(JsonNode.class));

    mockMvc.perform(post("/api/command").contentType(MediaType.APPLICATION_JSON).content(ARM))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.message").value("simulator not connected"));
  }

  @Test
  void command_invalidEnvelopeReturns400() throws Exception {
    doThrow(new ProtocolException("command message without an explicit targetId"))
        .when(hub).relayCommand(any(JsonNode.class));

    mockMvc.perform(post("/api/command").contentType(MediaType.APPLICATION_JSON).content("{\"type\":\"command\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("bad_request"));
  }
}
