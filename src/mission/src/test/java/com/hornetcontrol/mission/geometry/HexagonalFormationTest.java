package com.hornetcontrol.mission.geometry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class HexagonalFormationTest {

  @Test
  void positions_sixSlotsAtRadiusEverySixtyDegrees() {
    List<Position> slots = HexagonalFormation.positions(10.0, -20.0, 75.0, 30.0);

    assertThat(slots).hasSize(6);
    for (int i = 0; i < slots.size(); i++) {
      Position slot = slots.get(i);
      double dx = slot.x() - 10.0;
      double dy = slot.y() + 20.0;
      assertThat(slot.planarDistanceTo(new Position(10.0, -20.0, 0.0))).isCloseTo(30.0, within(1e-9));
      double angle = (Math.toDegrees(Math.atan2(dy, dx)) + 360.0) % 360.0;
      assertThat(angle).isCloseTo(i * 60.0, within(1e-6));
      assertThat(slot.z()).isEqualTo(75.0);
    }
  }

  @Test
  void positions_firstSlotOnPositiveXAxis() {
    Position first = HexagonalFormation.positions(new Position(0, 0, 100), 30.0).get(0);

    assertThat(first.x()).isCloseTo(30.0, within(1e-9));
    assertThat(first.y()).isCloseTo(0.0, within(1e-9));
  }

  @Test
  void positions_isDeterministic() {
    assertThat(HexagonalFormation.positions(1, 2, 3, 4)).isEqualTo(HexagonalFormation.positions(1, 2, 3, 4));
  }

  @Test
  void positions_rejectsInvalidRadius() {
    assertThatThrownBy(() -> HexagonalFormation.positions(0, 0, 0, 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> HexagonalFormation.positions(0, 0, 0, -5))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> HexagonalFormation.positions(0, 0, 0, Double.NaN))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
