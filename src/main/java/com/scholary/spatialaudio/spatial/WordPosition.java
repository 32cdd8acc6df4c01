package com.scholary.spatialaudio.spatial;

import com.scholary.spatialaudio.transcription.WordTiming;

/**
 * The spatial position assigned to one transcript word.
 *
 * @param index 0-based index in the whole transcript, independent of chunking
 * @param word word text
 * @param start word start in seconds, null if the transcript had none
 * @param end word end in seconds, null if the transcript had none
 * @param score transcription confidence, null if the transcript had none
 * @param position the position
 * @param confidence confidence of the position in [0,1]
 * @param method {@value #METHOD_PREDICTED} or {@value #METHOD_FALLBACK}
 */
public record WordPosition(
    int index,
    String word,
    Double start,
    Double end,
    Double score,
    Position position,
    double confidence,
    String method) {

  public static final String METHOD_PREDICTED = "gemini";
  public static final String METHOD_FALLBACK = "deterministic-fallback";

  /** Position from the deterministic curve. */
  static WordPosition fallback(int index, int total, WordTiming word) {
    return new WordPosition(
        index,
        word.word(),
        word.start(),
        word.end(),
        word.score(),
        SpatialMath.deterministicPosition(index, total),
        SpatialMath.FALLBACK_CONFIDENCE,
        METHOD_FALLBACK);
  }

  /** Position from a predictor, normalized. */
  static WordPosition predicted(WordTiming word, PredictedPosition prediction, String method) {
    return new WordPosition(
        prediction.index(),
        word.word(),
        word.start(),
        word.end(),
        word.score(),
        Position.of(prediction.azimuthPi(), prediction.elevationPi(), prediction.distance()),
        SpatialMath.normalizeConfidence(prediction.confidence()),
        method);
  }
}
