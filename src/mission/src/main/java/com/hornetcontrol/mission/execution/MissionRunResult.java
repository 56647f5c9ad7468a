package com.hornetcontrol.mission.execution;

/**
 * Outcome of one mission run.
 *
 * @param phase terminal phase
 * @param message abort or cancel reason, {@code null} on completion
 * @param dispatchedCommands commands handed to the relay during the run
 */
public record MissionRunResult(MissionPhase phase, String message, long dispatchedCommands) {}
