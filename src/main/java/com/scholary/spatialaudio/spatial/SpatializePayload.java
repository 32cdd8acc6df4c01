package com.scholary.spatialaudio.spatial;

import com.scholary.spatialaudio.stage.StagePayload;
import java.util.List;

/** Spatialize stage output. */
public record SpatializePayload(
    String provider,
    String model,
    String language,
    int wordCount,
    int chunkSize,
    int fallbackChunks,
    List<WordPosition> positions,
    List<AmbisonicEffect> effects)
    implements StagePayload {

  public SpatializePayload {
    positions = positions == null ? List.of() : List.copyOf(positions);
    effects = effects == null ? List.of() : List.copyOf(effects);
  }

  public static SpatializePayload from(
      SpatialPrediction prediction, String provider, String model, String language) {
    return new SpatializePayload(
        provider,
        model,
        language,
        prediction.positions().size(),
        prediction.chunkSize(),
        prediction.fallbackChunkCount(),
        prediction.positions(),
        prediction.effects());
  }
}
