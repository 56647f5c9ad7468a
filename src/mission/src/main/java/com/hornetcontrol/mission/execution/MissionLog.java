package com.hornetcontrol.mission.execution;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rolling operator log of the last {@value #MAX_ENTRIES} entries, oldest first.
 *
 * <p>Every entry is mirrored to SLF4J at the matching level.
 */
@Component
public class MissionLog {
  private static final Logger log = LoggerFactory.getLogger(MissionLog.class);
  public static final int MAX_ENTRIES = 50;

  private final Clock clock;
  private final Deque<MissionLogEntry> entries = new ArrayDeque<>();

  public MissionLog(Clock clock) {
    this.clock = clock;
  }

  public void info(String message) {
    append(LogSeverity.INFO, message);
  }

  public void warning(String message) {
    append(LogSeverity.WARNING, message);
  }

  public void error(String message) {
    append(LogSeverity.ERROR, message);
  }

  public synchronized List<MissionLogEntry> entries() {
    return List.copyOf(entries);
  }

  private synchronized void append(LogSeverity severity, String message) {
    switch (severity) {
      case WARNING -> log.warn(message);
      case ERROR -> log.error(message);
      default -> log.info(message);
    }
    entries.addLast(new MissionLogEntry(Instant.now(clock).toString(), severity, message));
    while (entries.size() > MAX_ENTRIES) {
      entries.removeFirst();
    }
  }
}
