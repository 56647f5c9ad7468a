package com.hornetcontrol.mission.service;

import com.hornetcontrol.mission.api.BadRequestException;
import com.hornetcontrol.mission.api.ConflictException;
import com.hornetcontrol.mission.api.NotFoundException;
import com.hornetcontrol.mission.client.MissionCatalogClient;
import com.hornetcontrol.mission.execution.MissionAlreadyRunningException;
import com.hornetcontrol.mission.execution.MissionExecutor;
import com.hornetcontrol.mission.model.Mission;
import com.hornetcontrol.mission.model.MissionRunRequest;
import com.hornetcontrol.mission.model.MissionRunStatus;
import com.hornetcontrol.mission.relay.FleetView;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves run requests into a mission and a target set and hands them to the orchestrator.
 */
@Service
public class MissionService {
  private static final Logger log = LoggerFactory.getLogger(MissionService.class);

  private final MissionExecutor executor;
  private final MissionCatalogClient catalogClient;
  private final FleetView fleetView;

  public MissionService(MissionExecutor executor, MissionCatalogClient catalogClient, FleetView fleetView) {
    this.executor = executor;
    this.catalogClient = catalogClient;
    this.fleetView = fleetView;
  }

  /**
   * Starts a mission run asynchronously.
   *
   * @param missionId catalog id
   * @param request explicit vehicle ids or a swarm id
   * @return run status right after the start
   * @throws MissionAlreadyRunningException when a run is active
   * @throws BadRequestException when the target set is invalid
   * @throws NotFoundException when the mission or the swarm is unknown
   */
  public MissionRunStatus startRun(String missionId, MissionRunRequest request) {
    if (executor.isRunning()) {
      throw new MissionAlreadyRunningException("a mission run is already active");
    }
    List<String> targets = resolveTargets(request);
    Mission mission = catalogClient.fetchMission(missionId)
        .orElseThrow(() -> new NotFoundException("mission not found: " + missionId));
    try {
      executor.start(mission, targets);
    } catch (IllegalArgumentException ex) {
      throw new BadRequestException(ex.getMessage());
    }
    log.info("Mission {} started for {}", missionId, targets);
    return executor.status();
  }

  public MissionRunStatus status() {
    return executor.status();
  }

  /**
   * Cancels the active run.
   *
   * @throws ConflictException when no run is active
   */
  public MissionRunStatus cancel() {
    if (!executor.cancel()) {
      throw new ConflictException("no mission run is active");
    }
    return executor.status();
  }

  List<String> resolveTargets(MissionRunRequest request) {
    if (request == null) {
      throw new BadRequestException("vehicleIds or swarmId is required");
    }
    boolean hasVehicles = request.vehicleIds() != null && !request.vehicleIds().isEmpty();
    boolean hasSwarm = request.swarmId() != null && !request.swarmId().isBlank();
    if (hasVehicles && hasSwarm) {
      throw new BadRequestException("give either vehicleIds or swarmId, not both");
    }
    if (hasVehicles) {
      return request.vehicleIds();
    }
    if (!hasSwarm) {
      throw new BadRequestException("vehicleIds or swarmId is required");
    }
    List<String> members = fleetView.swarmMembers(request.swarmId());
    if (members.isEmpty()) {
      throw new NotFoundException("swarm not found in fleet view: " + request.swarmId());
    }
    return members;
  }
}
