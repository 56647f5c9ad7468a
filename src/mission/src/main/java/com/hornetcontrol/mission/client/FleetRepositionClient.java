package com.hornetcontrol.mission.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hornetcontrol.mission.config.MissionProperties;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Client for the fleet reposition collaborator. Failures are reported, never thrown.
 */
@Component
public class FleetRepositionClient {
  private static final Logger log = LoggerFactory.getLogger(FleetRepositionClient.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final MissionProperties properties;

  public FleetRepositionClient(HttpClient httpClient, ObjectMapper objectMapper, MissionProperties properties) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Asks the collaborator to teleport vehicles.
   *
   * @param request circle, vehicle or swarm reposition
   * @return {@code true} on a 2xx answer
   */
  public boolean reposition(RepositionRequest request) {
    try {
      HttpRequest httpRequest = HttpRequest.newBuilder()
          .uri(URI.create(properties.api().baseUrl() + "/api/reset-positions"))
          .timeout(properties.api().timeout())
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(request)))
          .build();

      HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() >= 200 && response.statusCode() < 300) {
        log.debug("Fleet reposition accepted: {}", request);
        return true;
      }
      log.warn("Fleet reposition failed: status={}", response.statusCode());
      return false;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Fleet reposition interrupted");
      return false;
    } catch (Exception ex) {
      log.warn("Fleet reposition failed", ex);
      return false;
    }
  }
}
