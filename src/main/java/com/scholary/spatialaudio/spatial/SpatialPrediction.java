package com.scholary.spatialaudio.spatial;

import java.util.List;

/**
 * Output of {@link SpatialPositionSynthesizer#predict}.
 *
 * @param positions one entry per word, indices 0..N-1 in order
 * @param effects one entry per word
 * @param fallbackChunkCount chunks positioned entirely by the deterministic fallback
 * @param chunkSize chunk size used
 */
public record SpatialPrediction(
    List<WordPosition> positions,
    List<AmbisonicEffect> effects,
    int fallbackChunkCount,
    int chunkSize) {

  public SpatialPrediction {
    positions = List.copyOf(positions);
    effects = List.copyOf(effects);
  }
}
