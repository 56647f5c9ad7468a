package com.hornetcontrol.mission.execution;

import com.hornetcontrol.mission.geometry.Position;
import com.hornetcontrol.mission.relay.VehicleSnapshot;
import java.util.List;
import java.util.Map;

/** Maps target vehicles onto formation slots. */
public interface SlotAssignmentStrategy {
  /**
   * Assigns one distinct slot to each vehicle.
   *
   * @param vehicleIds target vehicles in dispatch order
   * @param slots formation slots in slot order
   * @param fleet current fleet view, possibly stale or incomplete
   * @return slot per vehicle, iterating in {@code vehicleIds} order
   */
  Map<String, Position> assign(List<String> vehicleIds, List<Position> slots, Map<String, VehicleSnapshot> fleet);
}
