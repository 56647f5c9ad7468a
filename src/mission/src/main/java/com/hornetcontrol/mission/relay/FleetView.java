package com.hornetcontrol.mission.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Eventually consistent copy of the relay snapshot, fed by relay messages.
 *
 * <p>The backing map is immutable and swapped on every write, so readers never lock. Merges use
 * the relay's rule: top-level fields present in the partial payload replace the stored ones.
 */
@Component
public class FleetView {
  private static final Logger log = LoggerFactory.getLogger(FleetView.class);

  private final ObjectMapper objectMapper;
  private volatile Map<String, ObjectNode> vehicles = Map.of();

  public FleetView(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Replaces the whole view with an {@code initial_state} payload.
   *
   * @param data object keyed by vehicle id
   */
  public synchronized void replaceAll(JsonNode data) {
    if (data == null || !data.isObject()) {
      throw new IllegalArgumentException("initial_state data must be an object");
    }
    Map<String, ObjectNode> next = new LinkedHashMap<>();
    data.fields().forEachRemaining(entry -> {
      if (entry.getValue().isObject()) {
        next.put(entry.getKey(), ((ObjectNode) entry.getValue()).deepCopy());
      }
    });
    vehicles = Collections.unmodifiableMap(next);
  }

  public synchronized void merge(String vehicleId, JsonNode partial) {
    if (partial == null || !partial.isObject()) {
      throw new IllegalArgumentException("state_update data must be an object");
    }
    Map<String, ObjectNode> next = new LinkedHashMap<>(vehicles);
    ObjectNode current = next.get(vehicleId);
    ObjectNode merged = current == null ? objectMapper.createObjectNode().put("id", vehicleId) : current.deepCopy();
    merged.setAll(((ObjectNode) partial).deepCopy());
    merged.put("id", vehicleId);
    next.put(vehicleId, merged);
    vehicles = Collections.unmodifiableMap(next);
  }

  /** Point-in-time typed view in relay order. */
  public Map<String, VehicleSnapshot> snapshot() {
    Map<String, VehicleSnapshot> result = new LinkedHashMap<>();
    vehicles.forEach((id, state) -> toSnapshot(id, state).ifPresent(snapshot -> result.put(id, snapshot)));
    return Collections.unmodifiableMap(result);
  }

  public Optional<VehicleSnapshot> vehicle(String vehicleId) {
    ObjectNode state = vehicles.get(vehicleId);
    return state == null ? Optional.empty() : toSnapshot(vehicleId, state);
  }

  public boolean isKnown(String vehicleId) {
    return vehicles.containsKey(vehicleId);
  }

  /**
   * Resolves swarm membership by filtering on swarm id.
   *
   * @param swarmId swarm identifier
   * @return member ids in relay order
   */
  public List<String> swarmMembers(String swarmId) {
    return snapshot().values().stream()
        .filter(vehicle -> swarmId != null && swarmId.equals(vehicle.swarm()))
        .map(VehicleSnapshot::id)
        .toList();
  }

  public int size() {
    return vehicles.size();
  }

  private Optional<VehicleSnapshot> toSnapshot(String id, JsonNode state) {
    try {
      VehicleSnapshot snapshot = objectMapper.treeToValue(state, VehicleSnapshot.class);
      if (snapshot.id() == null) {
        snapshot = new VehicleSnapshot(
            id, snapshot.swarm(), snapshot.position(), snapshot.status(), snapshot.armed(), snapshot.battery());
      }
      return Optional.of(snapshot);
    } catch (Exception ex) {
      log.debug("Vehicle {} state is not readable", id, ex);
      return Optional.empty();
    }
  }
}
