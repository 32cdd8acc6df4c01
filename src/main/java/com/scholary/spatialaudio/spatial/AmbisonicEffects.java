package com.scholary.spatialaudio.spatial;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the effect timeline from word positions.
 *
 * <p>Each word keeps its own transcript timing when it has one. A missing start continues from
 * the previous effect's end (0 for the first word), a missing end is {@code start +
 * MIN_DURATION_SECONDS}. Starts never move backwards, and every end is at least {@code
 * MIN_DURATION_SECONDS} after its start. Derived values only ever fill gaps; real word boundaries
 * are not replaced.
 */
public final class AmbisonicEffects {

  public static final double MIN_DURATION_SECONDS = 0.01;

  private AmbisonicEffects() {}

  public static List<AmbisonicEffect> build(List<WordPosition> positions) {
    List<AmbisonicEffect> effects = new ArrayList<>(positions.size());
    double previousStart = 0.0;
    double previousEnd = 0.0;

    for (int i = 0; i < positions.size(); i++) {
      WordPosition current = positions.get(i);
      WordPosition next = i + 1 < positions.size() ? positions.get(i + 1) : current;

      double start = isTime(current.start()) ? current.start() : previousEnd;
      if (i > 0) {
        start = Math.max(start, previousStart);
      }
      start = SpatialMath.round(start);

      double end = isTime(current.end()) ? current.end() : start + MIN_DURATION_SECONDS;
      end = SpatialMath.round(Math.max(end, start + MIN_DURATION_SECONDS));

      effects.add(
          new AmbisonicEffect(
              start,
              end,
              AmbisonicEffect.Move.between(current.position(), next.position()),
              new AmbisonicEffect.Metadata(
                  current.index(), current.word(), current.confidence(), current.method())));

      previousStart = start;
      previousEnd = end;
    }
    return effects;
  }

  private static boolean isTime(Double value) {
    return value != null && Double.isFinite(value) && value >= 0.0;
  }
}
