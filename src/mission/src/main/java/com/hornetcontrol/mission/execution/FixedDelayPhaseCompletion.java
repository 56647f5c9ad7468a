package com.hornetcontrol.mission.execution;

import java.time.Duration;
import java.util.List;

/** Treats a phase as complete once its settle window has elapsed. */
public class FixedDelayPhaseCompletion implements PhaseCompletionSignal {
  private final Sleeper sleeper;

  public FixedDelayPhaseCompletion(Sleeper sleeper) {
    this.sleeper = sleeper;
  }

  @Override
  public void awaitCompletion(MissionPhase phase, List<String> vehicleIds, Duration settle, CancellationToken token)
      throws InterruptedException {
    sleeper.sleep(settle, token);
  }
}
