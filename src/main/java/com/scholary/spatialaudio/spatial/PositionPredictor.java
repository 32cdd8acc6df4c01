package com.scholary.spatialaudio.spatial;

import java.util.List;

/** External source of word positions. */
public interface PositionPredictor {

  /**
   * Predict positions for the target words of a chunk.
   *
   * <p>The result may be incomplete; words without an entry are positioned deterministically.
   *
   * @param request the chunk with its context
   * @return raw positions keyed by transcript index
   * @throws PredictionException if the chunk cannot be predicted at all
   */
  List<PredictedPosition> predict(ChunkRequest request);

  /** Provider name recorded in the payload. */
  String provider();

  /** Model name, part of the cache key. */
  String model();

  /** Prompt or adapter version, part of the cache key. */
  String version();

  /** Method tag recorded on predicted words. */
  String method();
}
