package com.scholary.spatialaudio.spatial;

/**
 * Spherical position with angles in multiples of π.
 *
 * @param azimuthPi azimuth / π, in [0,2)
 * @param elevationPi polar angle / π measured from the vertical axis, in [0,1]; 0.5 is the horizon
 * @param distance distance from the listener, in [0.25,3.0]
 */
public record PositionPi(double azimuthPi, double elevationPi, double distance) {

  /** The same position in radians, rounded. */
  public PositionRad toRadians() {
    return new PositionRad(
        SpatialMath.round(azimuthPi * Math.PI),
        SpatialMath.round(elevationPi * Math.PI),
        distance);
  }
}
