package com.scholary.spatialaudio.spatial;

import com.scholary.spatialaudio.logging.StructuredLogger;
import com.scholary.spatialaudio.transcription.WordTiming;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a word-level transcript into spatial positions and an effect timeline.
 *
 * <p>The transcript is split into fixed-size chunks, each sent to the {@link PositionPredictor}
 * together with neighbouring context words and the last few positions already assigned. A chunk
 * the predictor cannot handle is positioned with the deterministic curve, so every word always
 * receives exactly one position regardless of the predictor's health.
 */
public class SpatialPositionSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpatialPositionSynthesizer.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public static final int MIN_CHUNK_SIZE = 12;
  static final int ANCHOR_COUNT = 4;

  private final PositionPredictor predictor;
  private final int chunkSize;
  private final int contextWords;

  public SpatialPositionSynthesizer(PositionPredictor predictor, SpatialProperties properties) {
    this.predictor = predictor;
    this.chunkSize = Math.max(MIN_CHUNK_SIZE, properties.chunkSize());
    this.contextWords = Math.max(0, properties.contextWords());
  }

  public int chunkSize() {
    return chunkSize;
  }

  public int contextWords() {
    return contextWords;
  }

  public PositionPredictor predictor() {
    return predictor;
  }

  /**
   * Position every word of a transcript.
   *
   * @param words the transcript words in order
   * @param language language hint, may be null
   * @return positions and effects for every word
   */
  public SpatialPrediction predict(List<WordTiming> words, String language) {
    if (words.isEmpty()) {
      return new SpatialPrediction(List.of(), List.of(), 0, chunkSize);
    }

    int total = words.size();
    List<WordPosition> positions = new ArrayList<>(total);
    int fallbackChunks = 0;
    int chunkIndex = 0;

    for (int start = 0; start < total; start += chunkSize, chunkIndex++) {
      int end = Math.min(total, start + chunkSize);

      ChunkRequest request =
          new ChunkRequest(
              indexed(words, start, end),
              indexed(words, Math.max(0, start - contextWords), start),
              indexed(words, end, Math.min(total, end + contextWords)),
              positions.subList(Math.max(0, positions.size() - ANCHOR_COUNT), positions.size()),
              language);

      long startTime = System.currentTimeMillis();
      WordPosition[] chunk;
      try {
        chunk = merge(words, start, end, predictor.predict(request));
        structuredLogger.logChunkPredicted(
            chunkIndex,
            start,
            end - start,
            countFallback(chunk),
            System.currentTimeMillis() - startTime);
      } catch (RuntimeException e) {
        fallbackChunks++;
        structuredLogger.logChunkFallback(
            chunkIndex, start, end - start, e.getClass().getSimpleName(), e.getMessage());
        chunk = new WordPosition[end - start];
        for (int i = start; i < end; i++) {
          chunk[i - start] = WordPosition.fallback(i, total, words.get(i));
        }
      }

      for (WordPosition position : chunk) {
        positions.add(position);
      }
    }

    LOGGER.info(
        "Spatialized {} words in {} chunks ({} fallback)", total, chunkIndex, fallbackChunks);

    return new SpatialPrediction(
        positions, AmbisonicEffects.build(positions), fallbackChunks, chunkSize);
  }

  /**
   * Place predictions into a slot per chunk word; empty slots get the deterministic position.
   * Predictions for indices outside the chunk, and repeats of an index, are ignored.
   */
  private WordPosition[] merge(
      List<WordTiming> words, int start, int end, List<PredictedPosition> predictions) {
    WordPosition[] chunk = new WordPosition[end - start];
    for (PredictedPosition prediction : predictions) {
      int slot = prediction.index() - start;
      if (slot >= 0 && slot < chunk.length && chunk[slot] == null) {
        chunk[slot] =
            WordPosition.predicted(words.get(prediction.index()), prediction, predictor.method());
      }
    }
    for (int slot = 0; slot < chunk.length; slot++) {
      if (chunk[slot] == null) {
        chunk[slot] = WordPosition.fallback(start + slot, words.size(), words.get(start + slot));
      }
    }
    return chunk;
  }

  private static int countFallback(WordPosition[] chunk) {
    int count = 0;
    for (WordPosition position : chunk) {
      if (WordPosition.METHOD_FALLBACK.equals(position.method())) {
        count++;
      }
    }
    return count;
  }

  private static List<IndexedWord> indexed(List<WordTiming> words, int from, int to) {
    List<IndexedWord> out = new ArrayList<>(Math.max(0, to - from));
    for (int i = from; i < to; i++) {
      out.add(IndexedWord.of(i, words.get(i)));
    }
    return out;
  }
}
