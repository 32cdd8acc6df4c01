package com.scholary.spatialaudio.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log pipeline events with structured fields that can be queried in
 * Kibana. Event fields are removed after each call; job context stays for the whole run.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log stage started event. */
  public void logStageStarted(String stage, String cacheKey) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage);
      MDC.put("cacheKey", cacheKey);

      logger.info("Stage started: stage={}, cacheKey={}", stage, cacheKey);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage finished event. */
  public void logStageFinished(String stage, boolean cacheHit, long elapsedMs) {
    try {
      MDC.put("event_type", "stage_finished");
      MDC.put("stage", stage);
      MDC.put("cacheHit", String.valueOf(cacheHit));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Stage finished: stage={}, cacheHit={}, elapsed={}ms", stage, cacheHit, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage failed event. */
  public void logStageFailed(String stage, String errorKind, String message) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("stage", stage);
      MDC.put("errorType", errorKind);

      logger.error("Stage failed: stage={}, error={}, message={}", stage, errorKind, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk predicted event. */
  public void logChunkPredicted(
      int chunkIndex, int firstWord, int wordCount, int filledWords, long predictMs) {
    try {
      MDC.put("event_type", "chunk_predicted");
      MDC.put("chunkIndex", String.valueOf(chunkIndex));
      MDC.put("firstWord", String.valueOf(firstWord));
      MDC.put("wordCount", String.valueOf(wordCount));
      MDC.put("filledWords", String.valueOf(filledWords));
      MDC.put("predictMs", String.valueOf(predictMs));

      logger.debug(
          "Chunk predicted: index={}, words=[{}+{}], filled={}, predict={}ms",
          chunkIndex,
          firstWord,
          wordCount,
          filledWords,
          predictMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk fallback event. */
  public void logChunkFallback(
      int chunkIndex, int firstWord, int wordCount, String errorType, String message) {
    try {
      MDC.put("event_type", "chunk_fallback");
      MDC.put("chunkIndex", String.valueOf(chunkIndex));
      MDC.put("firstWord", String.valueOf(firstWord));
      MDC.put("wordCount", String.valueOf(wordCount));
      MDC.put("errorType", errorType);

      logger.warn(
          "Chunk fallback: index={}, words=[{}+{}], error={}, message={}",
          chunkIndex,
          firstWord,
          wordCount,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String inputDigest) {
    MDC.put("jobId", jobId);
    MDC.put("inputDigest", inputDigest);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("inputDigest");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("cacheKey");
    MDC.remove("cacheHit");
    MDC.remove("elapsedMs");
    MDC.remove("errorType");
    MDC.remove("chunkIndex");
    MDC.remove("firstWord");
    MDC.remove("wordCount");
    MDC.remove("filledWords");
    MDC.remove("predictMs");
  }
}
