package com.hornetcontrol.mission.execution;

import com.hornetcontrol.mission.geometry.Position;
import com.hornetcontrol.mission.relay.VehicleSnapshot;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Vehicle {@code i} takes slot {@code i}. */
public class IndexSlotAssignment implements SlotAssignmentStrategy {

  @Override
  public Map<String, Position> assign(
      List<String> vehicleIds, List<Position> slots, Map<String, VehicleSnapshot> fleet) {
    if (vehicleIds.size() > slots.size()) {
      throw new IllegalArgumentException(
          vehicleIds.size() + " vehicles do not fit into " + slots.size() + " formation slots");
    }
    Map<String, Position> assignment = new LinkedHashMap<>();
    for (int i = 0; i < vehicleIds.size(); i++) {
      assignment.put(vehicleIds.get(i), slots.get(i));
    }
    return assignment;
  }
}
