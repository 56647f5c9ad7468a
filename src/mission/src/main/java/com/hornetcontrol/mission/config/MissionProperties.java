package com.hornetcontrol.mission.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mission")
public record MissionProperties(
    Relay relay,
    Api api,
    Formation formation,
    Flight flight,
    Timing timing,
    Projection projection) {

  /**
   * Observer connection to the relay hub.
   *
   * @param url observer WebSocket endpoint
   * @param reconnectMs fixed delay between connection attempts
   * @param autoConnect whether the reconnect loop opens the connection at all
   */
  public record Relay(String url, long reconnectMs, boolean autoConnect) {}

  /** Collaborator REST API (mission catalog and fleet repositioning). */
  public record Api(String baseUrl, Duration timeout) {}

  public record Formation(double radius, SlotAssignment slotAssignment) {}

  /**
   * @param initialAltitude takeoff and assembly altitude in meters
   * @param teleportRadius radius of the pre-mission reposition circle in meters
   */
  public record Flight(double initialAltitude, double teleportRadius) {}

  /** Stagger between sequential sends and settle windows closing each phase. */
  public record Timing(
      Duration commandStagger,
      Duration waypointStagger,
      Duration armSettle,
      Duration takeoffSettle,
      Duration formationSettle,
      Duration waypointSettle,
      Duration landSettle) {}

  public record Projection(double baseLng, double baseLat, double degreesPerMeter) {}

  public enum SlotAssignment {
    INDEX,
    NEAREST
  }
}
