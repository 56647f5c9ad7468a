package com.hornetcontrol.relay.hub;

import com.hornetcontrol.relay.config.RelayProperties;
import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Simulator channel: the sole telemetry producer.
 *
 * <p>A simulator may announce the vehicle it reports for with an {@code id} query parameter; the
 * hub uses it for state updates that carry no vehicle id of their own.
 */
@Component
public class SimulatorSocketHandler extends TextWebSocketHandler {
  private static final Logger log = LoggerFactory.getLogger(SimulatorSocketHandler.class);

  private final StateSyncHub hub;
  private final RelayProperties properties;

  public SimulatorSocketHandler(StateSyncHub hub, RelayProperties properties) {
    this.hub = hub;
    this.properties = properties;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    hub.registerSimulator(
        new ConcurrentWebSocketSessionDecorator(
            session, properties.getSendTimeLimitMs(), properties.getSendBufferSizeLimit()),
        announcedVehicleId(session.getUri()));
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    hub.ingest(session, message.getPayload());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.warn("Simulator {} transport error: {}", session.getId(), Disconnects.rootCauseSummary(exception));
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    hub.unregisterSimulator(session);
  }

  static String announcedVehicleId(URI uri) {
    if (uri == null) {
      return null;
    }
    String id = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("id");
    return id == null || id.isBlank() ? null : id;
  }
}
