package com.hornetcontrol.mission.execution;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class MissionLogTest {
  private final MissionLog missionLog =
      new MissionLog(Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));

  @Test
  void entries_keepsOnlyTheLatestFifty() {
    for (int i = 0; i < 60; i++) {
      missionLog.info("entry " + i);
    }

    List<MissionLogEntry> entries = missionLog.entries();
    assertThat(entries).hasSize(MissionLog.MAX_ENTRIES);
    assertThat(entries.get(0).message()).isEqualTo("entry 10");
    assertThat(entries.get(49).message()).isEqualTo("entry 59");
  }

  @Test
  void entries_areTimestampedAndTagged() {
    missionLog.warning("Teleport failed");
    missionLog.error("Relay error");

    assertThat(missionLog.entries())
        .extracting(MissionLogEntry::severity)
        .containsExactly(LogSeverity.WARNING, LogSeverity.ERROR);
    assertThat(missionLog.entries().get(0).timestamp()).isEqualTo("2026-03-01T10:00:00Z");
  }
}
