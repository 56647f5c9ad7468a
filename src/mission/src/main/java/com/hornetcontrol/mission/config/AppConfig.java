package com.hornetcontrol.mission.config;

import com.hornetcontrol.mission.execution.FixedDelayPhaseCompletion;
import com.hornetcontrol.mission.execution.IndexSlotAssignment;
import com.hornetcontrol.mission.execution.NearestSlotAssignment;
import com.hornetcontrol.mission.execution.PhaseCompletionSignal;
import com.hornetcontrol.mission.execution.Sleeper;
import com.hornetcontrol.mission.execution.SlotAssignmentStrategy;
import com.hornetcontrol.mission.geometry.CoordinateProjection;
import java.net.http.HttpClient;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

@Configuration
public class AppConfig {
  @Bean
  public HttpClient httpClient(MissionProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(properties.api().timeout())
        .build();
  }

  @Bean
  public WebSocketClient webSocketClient() {
    return new StandardWebSocketClient();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Sleeper sleeper() {
    return Sleeper.cancellable();
  }

  // Fixed timing windows; a telemetry-driven signal can replace this bean.
  @Bean
  public PhaseCompletionSignal phaseCompletionSignal(Sleeper sleeper) {
    return new FixedDelayPhaseCompletion(sleeper);
  }

  @Bean
  public SlotAssignmentStrategy slotAssignmentStrategy(MissionProperties properties) {
    if (properties.formation().slotAssignment() == MissionProperties.SlotAssignment.NEAREST) {
      return new NearestSlotAssignment();
    }
    return new IndexSlotAssignment();
  }

  @Bean
  public CoordinateProjection coordinateProjection(MissionProperties properties) {
    MissionProperties.Projection projection = properties.projection();
    return new CoordinateProjection(projection.baseLng(), projection.baseLat(), projection.degreesPerMeter());
  }
}
