package com.hornetcontrol.mission.model;

import com.hornetcontrol.mission.execution.MissionPhase;
import java.util.List;

/**
 * Response contract for the mission run endpoints.
 *
 * @param phase current or final phase
 * @param missionId mission of the current or last run
 * @param vehicleIds target vehicles of the current or last run
 * @param dispatchedCommands commands handed to the relay in the current or last run
 * @param failedCommands commands that could not be sent
 * @param lastError abort reason of the last failed run
 * @param startedAt ISO-8601 start time
 * @param finishedAt ISO-8601 end time, {@code null} while running
 * @param running whether a run is active
 */
public record MissionRunStatus(
    MissionPhase phase,
    String missionId,
    List<String> vehicleIds,
    long dispatchedCommands,
    long failedCommands,
    String lastError,
    String startedAt,
    String finishedAt,
    boolean running) {}
