package com.hornetcontrol.relay.hub;

import com.hornetcontrol.relay.config.RelayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/** Observer channel: receives commands and gets the telemetry fan-out. */
@Component
public class ObserverSocketHandler extends TextWebSocketHandler {
  private static final Logger log = LoggerFactory.getLogger(ObserverSocketHandler.class);

  private final StateSyncHub hub;
  private final RelayProperties properties;

  public ObserverSocketHandler(StateSyncHub hub, RelayProperties properties) {
    this.hub = hub;
    this.properties = properties;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    hub.registerObserver(new ConcurrentWebSocketSessionDecorator(
        session, properties.getSendTimeLimitMs(), properties.getSendBufferSizeLimit()));
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    hub.forward(session, message.getPayload());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.debug("Observer {} transport error: {}", session.getId(), Disconnects.rootCauseSummary(exception));
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    hub.unregisterObserver(session);
  }
}
