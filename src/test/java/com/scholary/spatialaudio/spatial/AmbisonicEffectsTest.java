package com.scholary.spatialaudio.spatial;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.spatialaudio.transcription.WordTiming;
import java.util.List;
import org.junit.jupiter.api.Test;

class AmbisonicEffectsTest {

  private static WordPosition position(int index, int total, Double start, Double end) {
    return WordPosition.fallback(index, total, new WordTiming("w" + index, start, end, null));
  }

  @Test
  void build_shouldKeepRealWordBoundaries() {
    List<AmbisonicEffect> effects =
        AmbisonicEffects.build(
            List.of(position(0, 2, 1.25, 1.5), position(1, 2, 3.0, 3.75)));

    assertThat(effects).extracting(AmbisonicEffect::start).containsExactly(1.25, 3.0);
    assertThat(effects).extracting(AmbisonicEffect::end).containsExactly(1.5, 3.75);
  }

  @Test
  void build_shouldContinueFromPreviousEndWhenStartIsMissing() {
    List<AmbisonicEffect> effects =
        AmbisonicEffects.build(
            List.of(
                position(0, 3, null, null),
                position(1, 3, 0.5, 0.8),
                position(2, 3, null, null)));

    assertThat(effects.get(0).start()).isEqualTo(0.0);
    assertThat(effects.get(0).end()).isEqualTo(AmbisonicEffects.MIN_DURATION_SECONDS);
    assertThat(effects.get(2).start()).isEqualTo(0.8);
    assertThat(effects.get(2).end()).isEqualTo(0.81);
  }

  @Test
  void build_shouldNeverMoveStartBackwards() {
    List<AmbisonicEffect> effects =
        AmbisonicEffects.build(List.of(position(0, 2, 2.0, 2.5), position(1, 2, 1.0, 1.2)));

    assertThat(effects.get(1).start()).isEqualTo(2.0);
    assertThat(effects.get(1).end()).isEqualTo(2.01);
  }

  @Test
  void build_shouldMoveTowardsNextWordAndCarryMetadata() {
    WordPosition first = position(0, 2, 0.0, 0.5);
    WordPosition second = position(1, 2, 0.5, 1.0);

    List<AmbisonicEffect> effects = AmbisonicEffects.build(List.of(first, second));

    AmbisonicEffect.Move move = effects.get(0).effect();
    assertThat(move.type()).isEqualTo("move");
    assertThat(move.fromRad()).isEqualTo(first.position().positionRad());
    assertThat(move.toRad()).isEqualTo(second.position().positionRad());
    assertThat(effects.get(1).effect().toPi()).isEqualTo(second.position().positionPi());
    assertThat(effects.get(0).metadata())
        .isEqualTo(
            new AmbisonicEffect.Metadata(
                0, "w0", SpatialMath.FALLBACK_CONFIDENCE, WordPosition.METHOD_FALLBACK));
  }
}
