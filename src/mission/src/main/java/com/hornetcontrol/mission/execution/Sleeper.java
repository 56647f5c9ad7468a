package com.hornetcontrol.mission.execution;

import java.time.Duration;

/** Timed wait used for staggers and settle windows. */
@FunctionalInterface
public interface Sleeper {
  /**
   * Waits for {@code duration}, returning early with {@link MissionCancelledException} when the
   * token is cancelled.
   */
  void sleep(Duration duration, CancellationToken token) throws InterruptedException;

  static Sleeper cancellable() {
    return (duration, token) -> {
      token.throwIfCancelled();
      if (duration.isNegative() || duration.isZero()) {
        return;
      }
      if (token.awaitCancellation(duration)) {
        token.throwIfCancelled();
      }
    };
  }
}
