package com.hornetcontrol.relay.config;

import com.hornetcontrol.relay.hub.ObserverSocketHandler;
import com.hornetcontrol.relay.hub.SimulatorSocketHandler;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the two relay channels: observers (fan-out) and the simulator (sole producer).
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
  private final RelayProperties properties;
  private final ObserverSocketHandler observerSocketHandler;
  private final SimulatorSocketHandler simulatorSocketHandler;

  public WebSocketConfig(
      RelayProperties properties,
      ObserverSocketHandler observerSocketHandler,
      SimulatorSocketHandler simulatorSocketHandler) {
    this.properties = properties;
    this.observerSocketHandler = observerSocketHandler;
    this.simulatorSocketHandler = simulatorSocketHandler;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    String[] origins = allowedOrigins();
    registry.addHandler(observerSocketHandler, properties.getObserverPath())
        .setAllowedOriginPatterns(origins);
    registry.addHandler(simulatorSocketHandler, properties.getSimulatorPath())
        .setAllowedOriginPatterns(origins);
  }

  private String[] allowedOrigins() {
    List<String> origins = properties.getAllowedOrigins().stream()
        .filter(origin -> origin != null && !origin.isBlank())
        .toList();
    if (origins.isEmpty()) {
      return new String[] {"*"};
    }
    return origins.toArray(String[]::new);
  }
}
