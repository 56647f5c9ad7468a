package com.hornetcontrol.mission.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command envelope sent to the relay.
 *
 * <p>Serialized as {@code {type:"command", command, params, targetId, timestamp}}. The target id
 * is captured when the command is built; a blank target or a missing required param is rejected.
 *
 * @param command verb
 * @param params verb parameters
 * @param targetId vehicle the command is addressed to
 * @param timestamp epoch milliseconds
 */
@JsonPropertyOrder({"type", "command", "params", "targetId", "timestamp"})
public record Command(CommandVerb command, Map<String, Object> params, String targetId, long timestamp) {
  public static final String TYPE = "command";

  public Command {
    if (command == null) {
      throw new IllegalArgumentException("command verb is required");
    }
    if (targetId == null || targetId.isBlank()) {
      throw new IllegalArgumentException("targetId is required for " + command.wireName());
    }
    Map<String, Object> copy = new LinkedHashMap<>(params == null ? Map.of() : params);
    for (String name : command.requiredParams()) {
      Object value = copy.get(name);
      if (!(value instanceof Number) || !Double.isFinite(((Number) value).doubleValue())) {
        throw new IllegalArgumentException(
            command.wireName() + " requires a finite numeric param '" + name + "'");
      }
    }
    params = Collections.unmodifiableMap(copy);
  }

  @JsonProperty("type")
  public String type() {
    return TYPE;
  }

  public static Command arm(String targetId, long timestamp) {
    return new Command(CommandVerb.ARM, Map.of(), targetId, timestamp);
  }

  public static Command disarm(String targetId, long timestamp) {
    return new Command(CommandVerb.DISARM, Map.of(), targetId, timestamp);
  }

  public static Command land(String targetId, long timestamp) {
    return new Command(CommandVerb.LAND, Map.of(), targetId, timestamp);
  }

  public static Command takeoff(String targetId, double altitude, long timestamp) {
    return new Command(CommandVerb.TAKEOFF, Map.of("altitude", altitude), targetId, timestamp);
  }

  public static Command goTo(String targetId, double x, double y, double z, long timestamp) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("x", x);
    params.put("y", y);
    params.put("z", z);
    return new Command(CommandVerb.GOTO, params, targetId, timestamp);
  }

  public static Command rotate(String targetId, double yaw, long timestamp) {
    return new Command(CommandVerb.ROTATE, Map.of("yaw", yaw), targetId, timestamp);
  }

  public static Command move(String targetId, double dx, double dy, double dz, long timestamp) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("dx", dx);
    params.put("dy", dy);
    params.put("dz", dz);
    return new Command(CommandVerb.MOVE, params, targetId, timestamp);
  }
}
