package com.hornetcontrol.relay.fleet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Flight status as reported by the simulator. */
public enum VehicleStatus {
  IDLE,
  ARMED,
  FLYING,
  LANDING;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a wire status, tolerating unknown values.
   *
   * @param value raw status text
   * @return matching status or {@code null} when unknown
   */
  @JsonCreator
  public static VehicleStatus fromWire(String value) {
    if (value == null) {
      return null;
    }
    for (VehicleStatus status : values()) {
      if (status.wireName().equalsIgnoreCase(value.trim())) {
        return status;
      }
    }
    return null;
  }
}
