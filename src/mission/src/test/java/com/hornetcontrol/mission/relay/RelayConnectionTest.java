package com.hornetcontrol.mission.relay;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hornetcontrol.mission.config.MissionProperties;
import com.hornetcontrol.mission.config.MissionPropertiesFixtures;
import com.hornetcontrol.mission.execution.LogSeverity;
import com.hornetcontrol.mission.execution.MissionLog;
import com.hornetcontrol.mission.execution.MissionLogEntry;
import com.hornetcontrol.mission.protocol.Command;
import com.hornetcontrol.mission.protocol.TransportException;
import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

@ExtendWith(MockitoExtension.class)
class RelayConnectionTest {
  @Mock private WebSocketClient webSocketClient;
  @Mock private WebSocketSession session;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private FleetView fleetView;
  private MissionLog missionLog;
  private RelayConnection connection;

  @BeforeEach
  void setUp() {
    fleetView = new FleetView(objectMapper);
    missionLog = new MissionLog(Clock.systemUTC());
    connection = new RelayConnection(
        MissionPropertiesFixtures.defaults(), webSocketClient, objectMapper, fleetView, missionLog);
    lenient().when(session.getId()).thenReturn("relay-1");
    lenient().when(session.isOpen()).thenReturn(true);
  }

  @Test
  void onMessage_initialStateReplacesFleetView() {
    connection.onMessage("""
        {"type":"initial_state","data":{
          "HORNET-1":{"id":"HORNET-1","swarm":"SWARM-1","position":{"x":0,"y":0,"z":0}},
          "HORNET-2":{"id":"HORNET-2","swarm":"SWARM-1","position":{"x":10,"y":10,"z":0}}}}
        """);

    assertThat(fleetView.size()).isEqualTo(2);
    assertThat(fleetView.swarmMembers("SWARM-1")).containsExactly("HORNET-1", "HORNET-2");
  }

  @Test
  void onMessage_stateUpdateMergesByTargetIdOrDataId() {
    connection.onMessage("{\"type\":\"state_update\",\"targetId\":\"HORNET-1\",\"data\":{\"status\":\"armed\"}}");
    connection.onMessage("{\"type\":\"state_update\",\"data\":{\"id\":\"HORNET-2\",\"battery\":88.5}}");
    connection.onMessage("{\"type\":\"state_update\",\"data\":{\"battery\":10}}");

    assertThat(fleetView.vehicle("HORNET-1").orElseThrow().status()).isEqualTo("armed");
    assertThat(fleetView.vehicle("HORNET-2").orElseThrow().battery()).isEqualTo(88.5);
    assertThat(fleetView.size()).isEqualTo(2);
  }

  @Test
  void onMessage_relayErrorsAndResponsesGoToMissionLog() {
    connection.onMessage("{\"type\":\"command_response\",\"command\":\"arm\",\"message\":\"UAV armed\"}");
    connection.onMessage("{\"type\":\"error\",\"message\":\"simulator not connected\"}");

    assertThat(missionLog.entries()).extracting(MissionLogEntry::message)
        .containsExactly("Command arm: UAV armed", "Error: simulator not connected");
    assertThat(missionLog.entries().get(1).severity()).isEqualTo(LogSeverity.ERROR);
  }

  @Test
  void onMessage_malformedInputIsDropped() {
    connection.onMessage("{not json");
    connection.onMessage("[1,2,3]");
    connection.onMessage("{\"type\":\"initial_state\",\"data\":42}");

    assertThat(fleetView.size()).isZero();
    assertThat(missionLog.entries()).isEmpty();
  }

  @Test
  void send_withoutConnectionThrowsTransportException() {
    assertThatThrownBy(() -> connection.send(Command.arm("HORNET-1", 1L)))
        .isInstanceOf(TransportException.class)
        .hasMessageContaining("not open");
  }

  @Test
  void send_writesEnvelopeToOpenSession() throws Exception {
    connection.afterConnectionEstablished(session);

    connection.send(Command.takeoff("HORNET-4", 100.0, 1700000000000L));

    ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
    verify(session).sendMessage(captor.capture());
    JsonNode sent = objectMapper.readTree(captor.getValue().getPayload());
    assertThat(sent.path("type").asText()).isEqualTo("command");
    assertThat(sent.path("command").asText()).isEqualTo("takeoff");
    assertThat(sent.path("targetId").asText()).isEqualTo("HORNET-4");
    assertThat(sent.path("params").path("altitude").asDouble()).isEqualTo(100.0);
  }

  @Test
  void send_wrapsSocketFailures() throws Exception {
    doThrow(new IOException("Broken pipe")).when(session).sendMessage(any());
    connection.afterConnectionEstablished(session);

    assertThatThrownBy(() -> connection.send(Command.land("HORNET-1", 1L)))
        .isInstanceOf(TransportException.class)
        .hasMessageContaining("land")
        .hasMessageContaining("HORNET-1");
  }

  @Test
  void afterConnectionClosed_dropsSession() {
    connection.afterConnectionEstablished(session);
    assertThat(connection.isConnected()).isTrue();

    connection.afterConnectionClosed(session, CloseStatus.GOING_AWAY);

    assertThat(connection.isConnected()).isFalse();
    assertThat(missionLog.entries()).extracting(MissionLogEntry::severity).contains(LogSeverity.WARNING);
  }

  @Test
  void ensureConnected_startsSingleAttemptAtATime() {
    when(webSocketClient.execute(any(WebSocketHandler.class), anyString()))
        .thenReturn(new CompletableFuture<>());

    connection.ensureConnected();
    connection.ensureConnected();

    verify(webSocketClient, times(1)).execute(eq(connection), eq("ws://localhost:3001/ws/client"));
  }

  @Test
  void ensureConnected_retriesAfterFailedAttempt() {
    when(webSocketClient.execute(any(WebSocketHandler.class), anyString()))
        .thenReturn(CompletableFuture.failedFuture(new IOException("Connection refused")));

    connection.ensureConnected();
    connection.ensureConnected();

    verify(webSocketClient, times(2)).execute(any(WebSocketHandler.class), anyString());
  }

  @Test
  void ensureConnected_disabledDoesNothing() {
    MissionProperties base = MissionPropertiesFixtures.defaults();
    MissionProperties disabled = new MissionProperties(
        new MissionProperties.Relay(base.relay().url(), base.relay().reconnectMs(), false),
        base.api(), base.formation(), base.flight(), base.timing(), base.projection());
    RelayConnection idle = new RelayConnection(disabled, webSocketClient, objectMapper, fleetView, missionLog);

    idle.ensureConnected();

    verify(webSocketClient, never()).execute(any(WebSocketHandler.class), anyString());
  }
}
