package com.hornetcontrol.mission.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hornetcontrol.mission.config.MissionProperties;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically replaces the {@link FleetView} with the relay's canonical snapshot.
 *
 * <p>Simulators that announce their id only at connect time send state updates without any id,
 * and the relay broadcasts those verbatim. Such updates cannot be merged here, so the view is
 * resynchronized from {@code GET /api/status} instead.
 */
@Component
public class FleetViewSync {
  private static final Logger log = LoggerFactory.getLogger(FleetViewSync.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final MissionProperties properties;
  private final FleetView fleetView;

  public FleetViewSync(
      HttpClient httpClient, ObjectMapper objectMapper, MissionProperties properties, FleetView fleetView) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.fleetView = fleetView;
  }

  @Scheduled(
      initialDelayString = "${mission.relay.reconnect-ms:3000}",
      fixedDelayString = "${mission.relay.reconnect-ms:3000}")
  public void scheduledResync() {
    if (!properties.relay().autoConnect()) {
      return;
    }
    resync();
  }

  /**
   * Fetches the relay status and replaces the fleet view with its vehicles.
   *
   * @return {@code true} when the view was replaced
   */
  public boolean resync() {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(properties.api().baseUrl() + "/api/status"))
        .timeout(properties.api().timeout())
        .GET()
        .build();
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() >= 400) {
        log.warn("Relay status fetch failed: status={}", response.statusCode());
        return false;
      }
      JsonNode vehicles = objectMapper.readTree(response.body()).path("vehicles");
      if (!vehicles.isArray()) {
        log.warn("Relay status carries no vehicle list");
        return false;
      }
      ObjectNode byId = objectMapper.createObjectNode();
      for (JsonNode vehicle : vehicles) {
        String id = vehicle.path("id").asText("");
        if (vehicle.isObject() && !id.isBlank()) {
          byId.set(id, vehicle);
        }
      }
      fleetView.replaceAll(byId);
      log.debug("Fleet view resynchronized with {} vehicles", byId.size());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    } catch (IOException | RuntimeException ex) {
      log.warn("Relay status fetch failed: {}", ex.getMessage());
      return false;
    }
  }
}
