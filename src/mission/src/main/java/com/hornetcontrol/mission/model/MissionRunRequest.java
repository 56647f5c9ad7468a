package com.hornetcontrol.mission.model;

import java.util.List;

/**
 * Request body for {@code POST /api/missions/{missionId}/run}: explicit vehicle ids or a swarm id.
 */
public record MissionRunRequest(List<String> vehicleIds, String swarmId) {}
