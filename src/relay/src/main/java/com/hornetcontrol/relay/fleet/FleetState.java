package com.hornetcontrol.relay.fleet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hornetcontrol.relay.config.RelayProperties;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Canonical per-vehicle state snapshot owned by the relay.
 *
 * <p>Vehicles are stored as JSON objects in first-seen order. A merge copies the stored object,
 * replaces the top-level fields present in the partial payload and publishes the copy, so nested
 * objects such as {@code position} are swapped as a whole and readers never see half a merge.
 */
@Component
public class FleetState {
  private static final Logger log = LoggerFactory.getLogger(FleetState.class);

  private final ObjectMapper objectMapper;
  private final RelayProperties properties;
  private final Map<String, ObjectNode> vehicles = new LinkedHashMap<>();

  public FleetState(ObjectMapper objectMapper, RelayProperties properties) {
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /** Seeds the default fleet when enabled in configuration. */
  @PostConstruct
  public void seedDefaults() {
    if (!properties.getFleet().isSeedDefaults()) {
      return;
    }
    seed(DefaultFleet.vehicles());
    log.info("Seeded canonical fleet with {} vehicles", size());
  }

  public synchronized void seed(Collection<Vehicle> seeds) {
    for (Vehicle vehicle : seeds) {
      vehicles.put(vehicle.id(), objectMapper.valueToTree(vehicle));
    }
  }

  /**
   * Merges a partial telemetry payload into one vehicle, creating it from defaults if unknown.
   *
   * <p>The stored {@code id} always stays equal to {@code vehicleId}, whatever the payload says.
   *
   * @param vehicleId target vehicle id
   * @param partial top-level fields to replace
   * @return copy of the merged vehicle state
   */
  public synchronized ObjectNode merge(String vehicleId, ObjectNode partial) {
    Objects.requireNonNull(vehicleId, "vehicleId");
    ObjectNode current = vehicles.get(vehicleId);
    ObjectNode merged = current == null
        ? objectMapper.valueToTree(Vehicle.defaults(vehicleId))
        : current.deepCopy();
    merged.setAll(partial.deepCopy());
    merged.put("id", vehicleId);
    vehicles.put(vehicleId, merged);
    return merged.deepCopy();
  }

  /** Returns a deep copy of the full snapshot keyed by vehicle id. */
  public synchronized ObjectNode snapshot() {
    ObjectNode snapshot = objectMapper.createObjectNode();
    vehicles.forEach((id, state) -> snapshot.set(id, state.deepCopy()));
    return snapshot;
  }

  public synchronized Optional<ObjectNode> vehicleState(String vehicleId) {
    ObjectNode state = vehicles.get(vehicleId);
    return state == null ? Optional.empty() : Optional.of(state.deepCopy());
  }

  public synchronized int size() {
    return vehicles.size();
  }

  /** Typed view of every vehicle whose stored state can be read as a {@link Vehicle}. */
  public List<Vehicle> vehicles() {
    List<Vehicle> result = new ArrayList<>();
    snapshot().fields().forEachRemaining(entry -> toVehicle(entry.getKey(), entry.getValue()).ifPresent(result::add));
    return result;
  }

  /**
   * Computes swarm membership by filtering vehicles on swarm id.
   *
   * @param swarmId swarm identifier
   * @return member vehicles in snapshot order
   */
  public List<Vehicle> swarm(String swarmId) {
    return vehicles().stream()
        .filter(vehicle -> swarmId != null && swarmId.equals(vehicle.swarm()))
        .toList();
  }

  private Optional<Vehicle> toVehicle(String id, JsonNode state) {
    try {
      return Optional.of(objectMapper.treeToValue(state, Vehicle.class));
    } catch (Exception ex) {
      log.debug("Vehicle {} state is not readable as a typed vehicle", id, ex);
      return Optional.empty();
    }
  }
}
