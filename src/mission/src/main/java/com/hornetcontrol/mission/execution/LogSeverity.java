package com.hornetcontrol.mission.execution;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum LogSeverity {
  INFO,
  WARNING,
  ERROR;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
