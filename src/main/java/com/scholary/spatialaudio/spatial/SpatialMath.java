package com.scholary.spatialaudio.spatial;

/** Normalization, rounding and the deterministic fallback curve. */
public final class SpatialMath {

  public static final double MIN_DISTANCE = 0.25;
  public static final double MAX_DISTANCE = 3.0;

  public static final double FALLBACK_CONFIDENCE = 0.45;

  private static final double DEFAULT_ELEVATION_PI = 0.5;
  private static final double DEFAULT_DISTANCE = 1.0;
  private static final double DEFAULT_CONFIDENCE = 0.5;
  private static final double SCALE = 10_000.0;

  private SpatialMath() {}

  /** Round to 4 decimal places. */
  public static double round(double value) {
    double rounded = Math.round(value * SCALE) / SCALE;
    // avoid -0.0 in persisted output
    return rounded == 0.0 ? 0.0 : rounded;
  }

  public static double clamp(double value, double lo, double hi) {
    return Math.max(lo, Math.min(hi, value));
  }

  /** Wrap into [0,2) and round; a value that rounds up to 2 wraps to 0. */
  public static double normalizeAzimuthPi(double azimuthPi) {
    if (!Double.isFinite(azimuthPi)) {
      return 0.0;
    }
    double wrapped = round(((azimuthPi % 2.0) + 2.0) % 2.0);
    return wrapped >= 2.0 ? 0.0 : wrapped;
  }

  public static double normalizeElevationPi(double elevationPi) {
    if (!Double.isFinite(elevationPi)) {
      return DEFAULT_ELEVATION_PI;
    }
    return round(clamp(elevationPi, 0.0, 1.0));
  }

  public static double normalizeDistance(double distance) {
    if (!Double.isFinite(distance)) {
      return DEFAULT_DISTANCE;
    }
    return round(clamp(distance, MIN_DISTANCE, MAX_DISTANCE));
  }

  public static double normalizeConfidence(double confidence) {
    if (!Double.isFinite(confidence)) {
      return DEFAULT_CONFIDENCE;
    }
    return round(clamp(confidence, 0.0, 1.0));
  }

  /**
   * Closed-form fallback position for a word.
   *
   * <p>A smooth curve over the word's fractional position in the whole transcript: one full turn
   * of azimuth, a gentle elevation wave and a faster distance wave.
   *
   * @param index the word's index in the transcript
   * @param total number of words in the transcript
   */
  public static Position deterministicPosition(int index, int total) {
    double frac = (double) index / Math.max(1, total - 1);
    double azimuthPi = (2.0 * frac) % 2.0;
    double elevationPi = clamp(0.5 + 0.18 * Math.sin(2.0 * Math.PI * frac), 0.0, 1.0);
    double distance = clamp(1.0 + 0.2 * Math.sin(4.0 * Math.PI * frac), 0.45, 2.5);
    return Position.of(azimuthPi, elevationPi, distance);
  }
}
