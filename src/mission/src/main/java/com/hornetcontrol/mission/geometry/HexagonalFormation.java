package com.hornetcontrol.mission.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Hexagonal formation around a center point.
 *
 * <p>Slot {@code i} sits at {@code i * 60} degrees from the center, exactly {@code radius} away,
 * at the center altitude. Slot order is significant: callers assign vehicles by slot index.
 */
public final class HexagonalFormation {
  public static final int SLOTS = 6;

  private HexagonalFormation() {}

  public static List<Position> positions(double centerX, double centerY, double centerZ, double radius) {
    if (!Double.isFinite(radius) || radius <= 0) {
      throw new IllegalArgumentException("formation radius must be a positive finite number: " + radius);
    }
    List<Position> positions = new ArrayList<>(SLOTS);
    for (int i = 0; i < SLOTS; i++) {
      double angle = Math.toRadians(i * 60.0);
      positions.add(new Position(
          centerX + radius * Math.cos(angle),
          centerY + radius * Math.sin(angle),
          centerZ));
    }
    return Collections.unmodifiableList(positions);
  }

  public static List<Position> positions(Position center, double radius) {
    return positions(center.x(), center.y(), center.z(), radius);
  }
}
