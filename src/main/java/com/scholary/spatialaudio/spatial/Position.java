package com.scholary.spatialaudio.spatial;

/**
 * A spatial position in three co-derived representations.
 *
 * <p>{@code positionRad} is always derived from {@code positionPi} and {@code positionXyz} from
 * {@code positionRad}, each from the already-rounded values, so re-deriving from stored values
 * reproduces the stored values exactly. Build instances through {@link #of}.
 */
public record Position(PositionPi positionPi, PositionRad positionRad, PositionXyz positionXyz) {

  /**
   * Normalize raw π-unit values and derive the other representations.
   *
   * <p>Azimuth is wrapped into [0,2), elevation clamped into [0,1], distance clamped into
   * [0.25,3.0]. Non-finite inputs take the neutral defaults (front, horizon, 1.0).
   */
  public static Position of(double azimuthPi, double elevationPi, double distance) {
    PositionPi pi =
        new PositionPi(
            SpatialMath.normalizeAzimuthPi(azimuthPi),
            SpatialMath.normalizeElevationPi(elevationPi),
            SpatialMath.normalizeDistance(distance));
    PositionRad rad = pi.toRadians();
    return new Position(pi, rad, rad.toCartesian());
  }
}
