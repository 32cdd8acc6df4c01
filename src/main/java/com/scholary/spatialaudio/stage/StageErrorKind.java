package com.scholary.spatialaudio.stage;

/** Why a stage failed. */
public enum StageErrorKind {
  /** Network error, timeout or non-success response from an external service. */
  ADAPTER_FAILURE,
  /** External response missing required fields, unparseable, or missing an archive member. */
  MALFORMED_RESPONSE,
  /** Filesystem or object-store failure. */
  STORAGE_FAILURE,
  /** Any other error raised while running the stage. */
  UNEXPECTED
}
