package com.hornetcontrol.mission.execution;

import com.hornetcontrol.mission.geometry.Position;
import com.hornetcontrol.mission.relay.VehicleSnapshot;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Greedy nearest-slot assignment in vehicle order, on planar distance.
 *
 * <p>A vehicle without a known position takes the first free slot.
 */
public class NearestSlotAssignment implements SlotAssignmentStrategy {

  @Override
  public Map<String, Position> assign(
      List<String> vehicleIds, List<Position> slots, Map<String, VehicleSnapshot> fleet) {
    if (vehicleIds.size() > slots.size()) {
      throw new IllegalArgumentException(
          vehicleIds.size() + " vehicles do not fit into " + slots.size() + " formation slots");
    }
    boolean[] taken = new boolean[slots.size()];
    Map<String, Position> assignment = new LinkedHashMap<>();
    for (String vehicleId : vehicleIds) {
      VehicleSnapshot vehicle = fleet.get(vehicleId);
      Position current = vehicle == null ? null : vehicle.position();
      int chosen = -1;
      double best = Double.MAX_VALUE;
      for (int slot = 0; slot < slots.size(); slot++) {
        if (taken[slot]) {
          continue;
        }
        if (current == null) {
          chosen = slot;
          break;
        }
        double distance = current.planarDistanceTo(slots.get(slot));
        if (distance < best) {
          best = distance;
          chosen = slot;
        }
      }
      taken[chosen] = true;
      assignment.put(vehicleId, slots.get(chosen));
    }
    return assignment;
  }
}
