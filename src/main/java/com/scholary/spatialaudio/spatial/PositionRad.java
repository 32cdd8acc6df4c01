package com.scholary.spatialaudio.spatial;

/**
 * Spherical position in radians.
 *
 * @param azimuth azimuth in radians, in [0,2π)
 * @param elevation polar angle in radians measured from the vertical axis, in [0,π]
 * @param distance distance from the listener
 */
public record PositionRad(double azimuth, double elevation, double distance) {

  /**
   * Cartesian coordinates, rounded.
   *
   * <p>{@code y} is the vertical axis: {@code y = d·cos(elevation)}, and the horizontal
   * projection {@code d·sin(elevation)} is split into {@code x} (cos azimuth) and {@code z} (sin
   * azimuth).
   */
  public PositionXyz toCartesian() {
    double horizontal = distance * Math.sin(elevation);
    return new PositionXyz(
        SpatialMath.round(horizontal * Math.cos(azimuth)),
        SpatialMath.round(distance * Math.cos(elevation)),
        SpatialMath.round(horizontal * Math.sin(azimuth)));
  }
}
