package com.scholary.spatialaudio.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Terminal status of a job. Jobs are persisted only once they reach one. */
public enum JobStatus {
  COMPLETED,
  FAILED;

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static JobStatus fromId(String id) {
    return valueOf(id.toUpperCase(Locale.ROOT));
  }
}
