package com.hornetcontrol.mission.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hornetcontrol.mission.config.MissionProperties;
import com.hornetcontrol.mission.execution.MissionLog;
import com.hornetcontrol.mission.protocol.Command;
import com.hornetcontrol.mission.protocol.CommandSender;
import com.hornetcontrol.mission.protocol.RelayMessageType;
import com.hornetcontrol.mission.protocol.TransportException;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Observer connection to the relay hub.
 *
 * <p>Sends command envelopes and feeds every relay message into the {@link FleetView}. A lost
 * connection is reopened by the fixed-delay reconnect loop; commands sent while disconnected fail
 * with {@link TransportException}.
 */
@Component
public class RelayConnection extends TextWebSocketHandler implements CommandSender {
  private static final Logger log = LoggerFactory.getLogger(RelayConnection.class);
  private static final int SEND_TIME_LIMIT_MS = 5_000;
  private static final int SEND_BUFFER_SIZE_LIMIT = 512 * 1024;

  private final MissionProperties properties;
  private final WebSocketClient webSocketClient;
  private final ObjectMapper objectMapper;
  private final FleetView fleetView;
  private final MissionLog missionLog;
  private final AtomicBoolean connecting = new AtomicBoolean(false);
  private volatile WebSocketSession session;

  public RelayConnection(
      MissionProperties properties,
      WebSocketClient webSocketClient,
      ObjectMapper objectMapper,
      FleetView fleetView,
      MissionLog missionLog) {
    this.properties = properties;
    this.webSocketClient = webSocketClient;
    this.objectMapper = objectMapper;
    this.fleetView = fleetView;
    this.missionLog = missionLog;
  }

  @Scheduled(fixedDelayString = "${mission.relay.reconnect-ms:3000}")
  public void ensureConnected() {
    if (!properties.relay().autoConnect() || isConnected()) {
      return;
    }
    if (!connecting.compareAndSet(false, true)) {
      return;
    }
    String url = properties.relay().url();
    log.debug("Connecting to relay at {}", url);
    webSocketClient.execute(this, url).whenComplete((opened, ex) -> {
      connecting.set(false);
      if (ex != null) {
        log.warn("Relay at {} unreachable, retrying in {} ms: {}",
            url, properties.relay().reconnectMs(), ex.getMessage());
      }
    });
  }

  public boolean isConnected() {
    WebSocketSession current = session;
    return current != null && current.isOpen();
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession newSession) {
    session = new ConcurrentWebSocketSessionDecorator(newSession, SEND_TIME_LIMIT_MS, SEND_BUFFER_SIZE_LIMIT);
    missionLog.info("Connected to relay");
  }

  @Override
  public void afterConnectionClosed(WebSocketSession closed, CloseStatus status) {
    WebSocketSession current = session;
    if (current != null && current.getId().equals(closed.getId())) {
      session = null;
    }
    missionLog.warning("Disconnected from relay (" + status.getCode() + ")");
  }

  @Override
  public void handleTransportError(WebSocketSession failed, Throwable exception) {
    log.warn("Relay transport error on session {}: {}", failed.getId(), exception.getMessage());
  }

  @Override
  protected void handleTextMessage(WebSocketSession source, TextMessage message) {
    onMessage(message.getPayload());
  }

  /**
   * Applies one relay message. Malformed messages are logged and dropped.
   *
   * @param payload raw text frame
   */
  void onMessage(String payload) {
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      log.warn("Dropping malformed relay message: {}", ex.getOriginalMessage());
      return;
    }
    if (root == null || !root.isObject()) {
      log.warn("Dropping relay message that is not a JSON object");
      return;
    }
    try {
      switch (root.path("type").asText()) {
        case RelayMessageType.INITIAL_STATE -> {
          fleetView.replaceAll(root.get("data"));
          log.info("Fleet view initialized with {} vehicles", fleetView.size());
        }
        case RelayMessageType.STATE_UPDATE -> applyStateUpdate(root);
        case RelayMessageType.COMMAND_RESPONSE -> missionLog.info(
            "Command " + root.path("command").asText() + ": " + root.path("message").asText());
        case RelayMessageType.ERROR -> missionLog.error("Error: " + root.path("message").asText());
        default -> log.debug("Ignoring relay message of type {}", root.path("type").asText());
      }
    } catch (IllegalArgumentException ex) {
      log.warn("Dropping relay message: {}", ex.getMessage());
    }
  }

  private void applyStateUpdate(JsonNode root) {
    JsonNode data = root.get("data");
    String vehicleId = text(root.get("targetId"));
    if (vehicleId == null && data != null) {
      vehicleId = text(data.get("id"));
    }
    if (vehicleId == null) {
      log.debug("Ignoring state_update without a vehicle id");
      return;
    }
    fleetView.merge(vehicleId, data);
  }

  @Override
  public void send(Command command) {
    WebSocketSession current = session;
    if (current == null || !current.isOpen()) {
      throw new TransportException("relay connection is not open");
    }
    try {
      current.sendMessage(new TextMessage(objectMapper.writeValueAsString(command)));
    } catch (IOException | RuntimeException ex) {
      throw new TransportException(
          "failed to send " + command.command().wireName() + " to " + command.targetId(), ex);
    }
  }

  @PreDestroy
  public void close() {
    WebSocketSession current = session;
    session = null;
    if (current == null || !current.isOpen()) {
      return;
    }
    try {
      current.close(CloseStatus.GOING_AWAY);
    } catch (IOException ex) {
      log.debug("Failed to close relay session cleanly", ex);
    }
  }

  private static String text(JsonNode node) {
    if (node == null || !node.isTextual() || node.asText().isBlank()) {
      return null;
    }
    return node.asText();
  }
}
