package com.hornetcontrol.relay.hub;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hornetcontrol.relay.fleet.FleetState;
import com.hornetcontrol.relay.protocol.MessageType;
import com.hornetcontrol.relay.protocol.ProtocolException;
import com.hornetcontrol.relay.protocol.RelayMessages;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * State synchronization hub: the single source of truth and fan-out relay.
 *
 * <p>This component:
 * <ul>
 *   <li>keeps exactly one authoritative simulator connection (latest registration wins)</li>
 *   <li>relays observer commands verbatim to the simulator</li>
 *   <li>merges simulator state updates into the canonical {@link FleetState}</li>
 *   <li>broadcasts every simulator message verbatim to all observers</li>
 * </ul>
 *
 * <p>Malformed input is logged and dropped without closing the connection. Broadcast is
 * best-effort per observer.
 */
@Service
public class StateSyncHub {
  private static final Logger log = LoggerFactory.getLogger(StateSyncHub.class);
  static final String SIMULATOR_NOT_CONNECTED = "simulator not connected";

  private final FleetState fleetState;
  private final RelayMessages messages;
  private final Map<String, WebSocketSession> observers = new ConcurrentHashMap<>();
  private final AtomicReference<SimulatorLink> simulator = new AtomicReference<>();
  // Guards snapshot-then-join against merge-then-broadcast.
  private final Object fanOutLock = new Object();
  private final Counter forwardedCounter;
  private final Counter rejectedCounter;
  private final Counter ingestedCounter;
  private final Counter malformedCounter;
  private final Counter broadcastFailureCounter;

  public StateSyncHub(FleetState fleetState, RelayMessages messages, MeterRegistry meterRegistry) {
    this.fleetState = fleetState;
    this.messages = messages;
    this.forwardedCounter = meterRegistry.counter("relay.commands.forwarded");
    this.rejectedCounter = meterRegistry.counter("relay.commands.rejected");
    this.ingestedCounter = meterRegistry.counter("relay.telemetry.ingested");
    this.malformedCounter = meterRegistry.counter("relay.messages.malformed");
    this.broadcastFailureCounter = meterRegistry.counter("relay.broadcast.failures");
    meterRegistry.gauge("relay.observers.connected", observers, Map::size);
    meterRegistry.gauge("relay.simulator.connected", this, hub -> hub.isSimulatorConnected() ? 1 : 0);
  }

  /**
   * Sends the full snapshot to an observer, then adds it to the broadcast set.
   *
   * <p>Every update merged after the snapshot reaches the observer after its {@code initial_state}.
   *
   * @param session observer connection, already safe for concurrent sends
   */
  public void registerObserver(WebSocketSession session) {
    synchronized (fanOutLock) {
      send(session, messages.initialState(fleetState.snapshot()), MessageType.INITIAL_STATE);
      observers.put(session.getId(), session);
    }
    log.info("Observer {} connected ({} total)", session.getId(), observers.size());
  }

  public void unregisterObserver(WebSocketSession session) {
    if (observers.remove(session.getId()) != null) {
      log.info("Observer {} disconnected ({} remaining)", session.getId(), observers.size());
    }
  }

  /**
   * Makes {@code session} the authoritative simulator, superseding any previous one.
   *
   * @param session simulator connection, already safe for concurrent sends
   * @param defaultVehicleId vehicle id announced at connect time, may be {@code null}
   */
  public void registerSimulator(WebSocketSession session, String defaultVehicleId) {
    SimulatorLink previous = simulator.getAndSet(new SimulatorLink(session, defaultVehicleId));
    if (previous != null && !previous.session().getId().equals(session.getId())) {
      log.info("Simulator {} superseded by {}", previous.session().getId(), session.getId());
    } else {
      log.info("Simulator {} connected", session.getId());
    }
  }

  /** Clears the authoritative pointer, but only if {@code session} is still the current one. */
  public void unregisterSimulator(WebSocketSession session) {
    SimulatorLink current = simulator.get();
    if (current != null
        && current.session().getId().equals(session.getId())
        && simulator.compareAndSet(current, null)) {
      log.info("Simulator {} disconnected", session.getId());
      return;
    }
    log.debug("Ignoring close of non-authoritative simulator {}", session.getId());
  }

  public boolean isSimulatorConnected() {
    SimulatorLink current = simulator.get();
    return current != null && current.session().isOpen();
  }

  public int observerCount() {
    return observers.size();
  }

  /**
   * Relays an observer message verbatim to the simulator.
   *
   * <p>When no open simulator is registered, only the originating observer receives an error;
   * nothing is broadcast and no shared state changes.
   *
   * @param origin observer that sent the message
   * @param payload raw text frame
   */
  public void forward(WebSocketSession origin, String payload) {
    try {
      messages.requireValidCommand(messages.parse(payload));
    } catch (ProtocolException ex) {
      malformedCounter.increment();
      log.warn("Dropping malformed message from observer {}: {}", origin.getId(), ex.getMessage());
      return;
    }

    WebSocketSession replyTo = observers.getOrDefault(origin.getId(), origin);
    SimulatorLink current = simulator.get();
    if (current == null || !current.session().isOpen()) {
      rejectedCounter.increment();
      send(replyTo, messages.error(SIMULATOR_NOT_CONNECTED), MessageType.ERROR);
      return;
    }
    try {
      current.session().sendMessage(new TextMessage(payload));
      forwardedCounter.increment();
    } catch (IOException | RuntimeException ex) {
      log.warn("Failed to relay observer {} message to simulator: {}",
          origin.getId(), Disconnects.rootCauseSummary(ex));
    }
  }

  /**
   * Relays a command submitted over REST.
   *
   * @param command command envelope
   * @throws ProtocolException when the envelope breaks the command contract
   * @throws SimulatorUnavailableException when no open simulator is registered or the send fails
   */
  public void relayCommand(JsonNode command) {
    if (command == null || !command.isObject()) {
      throw new ProtocolException("payload is not a JSON object");
    }
    messages.requireValidCommand(command);
    SimulatorLink current = simulator.get();
    if (current == null || !current.session().isOpen()) {
      rejectedCounter.increment();
      throw new SimulatorUnavailableException(SIMULATOR_NOT_CONNECTED);
    }
    try {
      current.session().sendMessage(new TextMessage(messages.write(command)));
      forwardedCounter.increment();
    } catch (IOException ex) {
      throw new SimulatorUnavailableException("failed to relay command to simulator", ex);
    }
  }

  /**
   * Ingests one simulator frame: merges state updates, then broadcasts the frame verbatim.
   *
   * @param source simulator connection the frame came from
   * @param payload raw text frame
   */
  public void ingest(WebSocketSession source, String payload) {
    SimulatorLink current = simulator.get();
    if (current == null || !current.session().getId().equals(source.getId())) {
      log.debug("Ignoring input from superseded simulator {}", source.getId());
      return;
    }

    synchronized (fanOutLock) {
      try {
        ObjectNode message = messages.parse(payload);
        if (MessageType.STATE_UPDATE.equals(message.path("type").asText())) {
          mergeStateUpdate(message, current);
        }
      } catch (ProtocolException ex) {
        malformedCounter.increment();
        log.warn("Dropping malformed message from simulator {}: {}", source.getId(), ex.getMessage());
        return;
      }
      broadcast(payload);
    }
  }

  private void mergeStateUpdate(ObjectNode message, SimulatorLink link) {
    JsonNode data = message.get("data");
    if (data == null || !data.isObject()) {
      throw new ProtocolException("state_update without an object data payload");
    }
    String vehicleId = resolveVehicleId(message, data, link);
    if (vehicleId == null) {
      throw new ProtocolException("state_update without a vehicle id");
    }
    fleetState.merge(vehicleId, (ObjectNode) data);
    ingestedCounter.increment();
  }

  private static String resolveVehicleId(JsonNode message, JsonNode data, SimulatorLink link) {
    String targetId = text(message.get("targetId"));
    if (targetId != null) {
      return targetId;
    }
    String dataId = text(data.get("id"));
    if (dataId != null) {
      return dataId;
    }
    return link.defaultVehicleId();
  }

  private static String text(JsonNode node) {
    if (node == null || !node.isTextual() || node.asText().isBlank()) {
      return null;
    }
    return node.asText();
  }

  private void broadcast(String payload) {
    TextMessage frame = new TextMessage(payload);
    for (WebSocketSession observer : observers.values()) {
      if (!observer.isOpen()) {
        log.debug("Skipping closed observer {}", observer.getId());
        continue;
      }
      deliver(observer, frame, "telemetry");
    }
  }

  private void send(WebSocketSession session, String payload, String messageType) {
    if (!session.isOpen()) {
      log.debug("Skipping {} delivery to closed session {}", messageType, session.getId());
      return;
    }
    deliver(session, new TextMessage(payload), messageType);
  }

  private void deliver(WebSocketSession session, TextMessage frame, String messageType) {
    try {
      session.sendMessage(frame);
    } catch (IOException | RuntimeException ex) {
      broadcastFailureCounter.increment();
      if (Disconnects.isExpectedClientDisconnect(ex)) {
        log.debug("Observer {} disconnected during {} delivery: {}",
            session.getId(), messageType, Disconnects.rootCauseSummary(ex));
        return;
      }
      log.warn("Delivery of {} to session {} failed", messageType, session.getId(), ex);
    }
  }

  private record SimulatorLink(WebSocketSession session, String defaultVehicleId) {}
}
