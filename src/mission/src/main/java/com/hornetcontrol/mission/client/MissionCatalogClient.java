package com.hornetcontrol.mission.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hornetcontrol.mission.config.MissionProperties;
import com.hornetcontrol.mission.model.Mission;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads mission definitions from the mission catalog collaborator.
 */
@Component
public class MissionCatalogClient {
  private static final Logger log = LoggerFactory.getLogger(MissionCatalogClient.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final MissionProperties properties;

  public MissionCatalogClient(HttpClient httpClient, ObjectMapper objectMapper, MissionProperties properties) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Fetches one mission.
   *
   * @param missionId catalog id
   * @return the mission, or empty when the catalog answers 404
   * @throws MissionCatalogException on transport errors, other error statuses or unreadable bodies
   */
  public Optional<Mission> fetchMission(String missionId) {
    String url = properties.api().baseUrl() + "/api/missions/"
        + URLEncoder.encode(missionId, StandardCharsets.UTF_8).replace("+", "%20");
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .timeout(properties.api().timeout())
        .GET()
        .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new MissionCatalogException("mission catalog request interrupted", ex);
    } catch (IOException ex) {
      throw new MissionCatalogException("mission catalog unreachable: " + ex.getMessage(), ex);
    }

    if (response.statusCode() == 404) {
      return Optional.empty();
    }
    if (response.statusCode() >= 400) {
      log.warn("Mission catalog fetch failed: id={}, status={}", missionId, response.statusCode());
      throw new MissionCatalogException("mission catalog returned status " + response.statusCode());
    }
    try {
      Mission mission = objectMapper.readValue(response.body(), Mission.class);
      if (mission.id() == null) {
        mission = new Mission(missionId, mission.name(), mission.origin(), mission.trajectories());
      }
      return Optional.of(mission);
    } catch (JsonProcessingException ex) {
      throw new MissionCatalogException("mission " + missionId + " is not readable: " + ex.getOriginalMessage(), ex);
    }
  }
}
