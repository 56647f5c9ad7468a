package com.hornetcontrol.mission.execution;

import java.time.Duration;
import java.util.List;

/**
 * Decides when a phase is done and the next one may start.
 *
 * <p>Implementations may wait on time only or on vehicle telemetry; the settle window is the
 * configured upper bound for the phase.
 */
public interface PhaseCompletionSignal {
  void awaitCompletion(MissionPhase phase, List<String> vehicleIds, Duration settle, CancellationToken token)
      throws InterruptedException;
}
