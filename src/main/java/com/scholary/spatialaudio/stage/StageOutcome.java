package com.scholary.spatialaudio.stage;

import java.util.Objects;

/**
 * Result of running a stage: either a payload or a classified error.
 *
 * <p>The orchestrator inspects the tag instead of unwinding through exceptions, which keeps the
 * results of earlier stages in hand when a later stage fails.
 *
 * @param <T> the stage payload type
 */
public final class StageOutcome<T> {

  private final T payload;
  private final boolean cacheHit;
  private final StageErrorKind errorKind;
  private final String errorMessage;

  private StageOutcome(T payload, boolean cacheHit, StageErrorKind errorKind, String errorMessage) {
    this.payload = payload;
    this.cacheHit = cacheHit;
    this.errorKind = errorKind;
    this.errorMessage = errorMessage;
  }

  public static <T> StageOutcome<T> ok(T payload, boolean cacheHit) {
    return new StageOutcome<>(Objects.requireNonNull(payload, "payload"), cacheHit, null, null);
  }

  public static <T> StageOutcome<T> failed(StageErrorKind kind, String message) {
    return new StageOutcome<>(null, false, Objects.requireNonNull(kind, "kind"), message);
  }

  public boolean isOk() {
    return errorKind == null;
  }

  /**
   * The payload of a successful outcome.
   *
   * @throws IllegalStateException if the outcome is a failure
   */
  public T payload() {
    if (!isOk()) {
      throw new IllegalStateException("Stage failed: " + errorKind);
    }
    return payload;
  }

  public boolean cacheHit() {
    return cacheHit;
  }

  public StageErrorKind errorKind() {
    return errorKind;
  }

  public String errorMessage() {
    return errorMessage;
  }

  @Override
  public String toString() {
    return isOk()
        ? "StageOutcome[ok, cacheHit=" + cacheHit + "]"
        : "StageOutcome[failed, kind=" + errorKind + ", message=" + errorMessage + "]";
  }
}
