package com.scholary.spatialaudio.spatial;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PositionTest {

  @Test
  void of_shouldDeriveRadiansAndCartesianFromRoundedPiUnits() {
    Position position = Position.of(0.123456, 0.654321, 1.234567);

    assertThat(position.positionPi()).isEqualTo(new PositionPi(0.1235, 0.6543, 1.2346));
    assertThat(position.positionRad()).isEqualTo(position.positionPi().toRadians());
    assertThat(position.positionXyz()).isEqualTo(position.positionRad().toCartesian());
  }

  @Test
  void rederivingFromStoredValues_shouldReproduceThem() {
    for (int i = 0; i < 50; i++) {
      Position position = SpatialMath.deterministicPosition(i, 50);
      PositionPi pi = position.positionPi();

      Position again = Position.of(pi.azimuthPi(), pi.elevationPi(), pi.distance());

      assertThat(again).isEqualTo(position);
    }
  }

  @Test
  void toCartesian_shouldUseVerticalYAxis() {
    assertThat(Position.of(0.0, 0.5, 1.0).positionXyz()).isEqualTo(new PositionXyz(1.0, 0.0, 0.0));
    assertThat(Position.of(0.5, 0.5, 2.0).positionXyz()).isEqualTo(new PositionXyz(0.0, 0.0, 2.0));
    assertThat(Position.of(0.0, 0.0, 1.5).positionXyz()).isEqualTo(new PositionXyz(0.0, 1.5, 0.0));
  }

  @Test
  void of_shouldWrapAzimuthIntoHalfOpenRange() {
    assertThat(Position.of(2.5, 0.5, 1.0).positionPi().azimuthPi()).isEqualTo(0.5);
    assertThat(Position.of(-0.5, 0.5, 1.0).positionPi().azimuthPi()).isEqualTo(1.5);
    assertThat(Position.of(2.0, 0.5, 1.0).positionPi().azimuthPi()).isEqualTo(0.0);
    assertThat(Position.of(1.99999, 0.5, 1.0).positionPi().azimuthPi()).isEqualTo(0.0);
  }

  @Test
  void of_shouldClampElevationAndDistance() {
    PositionPi high = Position.of(0.0, 1.7, 10.0).positionPi();
    PositionPi low = Position.of(0.0, -0.3, 0.01).positionPi();

    assertThat(high.elevationPi()).isEqualTo(1.0);
    assertThat(high.distance()).isEqualTo(3.0);
    assertThat(low.elevationPi()).isEqualTo(0.0);
    assertThat(low.distance()).isEqualTo(0.25);
  }

  @Test
  void of_shouldReplaceNonFiniteValuesWithDefaults() {
    PositionPi pi = Position.of(Double.NaN, Double.POSITIVE_INFINITY, Double.NaN).positionPi();

    assertThat(pi).isEqualTo(new PositionPi(0.0, 0.5, 1.0));
  }

  @Test
  void deterministicPosition_shouldStayInRange() {
    for (int i = 0; i < 200; i++) {
      PositionPi pi = SpatialMath.deterministicPosition(i, 200).positionPi();

      assertThat(pi.azimuthPi()).isGreaterThanOrEqualTo(0.0).isLessThan(2.0);
      assertThat(pi.elevationPi()).isBetween(0.0, 1.0);
      assertThat(pi.distance()).isBetween(0.25, 3.0);
    }
  }
}
