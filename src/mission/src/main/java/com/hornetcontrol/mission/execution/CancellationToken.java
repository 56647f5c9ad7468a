package com.hornetcontrol.mission.execution;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** One-shot cancellation flag for a single mission run. Waits on it end early when cancelled. */
public class CancellationToken {
  private final CountDownLatch cancelled = new CountDownLatch(1);

  public void cancel() {
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  public void throwIfCancelled() {
    if (isCancelled()) {
      throw new MissionCancelledException("mission run cancelled");
    }
  }

  /**
   * Blocks for up to {@code timeout} or until cancelled.
   *
   * @return {@code true} if the token was cancelled
   */
  public boolean awaitCancellation(Duration timeout) throws InterruptedException {
    return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}
