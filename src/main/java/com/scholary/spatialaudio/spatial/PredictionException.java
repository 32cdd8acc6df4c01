package com.scholary.spatialaudio.spatial;

/**
 * Thrown when a predictor cannot position a chunk.
 *
 * <p>Never fails a job: the synthesizer falls back to deterministic positions for the chunk.
 */
public class PredictionException extends RuntimeException {

  public PredictionException(String message) {
    super(message);
  }

  public PredictionException(String message, Throwable cause) {
    super(message, cause);
  }
}
