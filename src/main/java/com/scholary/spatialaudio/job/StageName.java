package com.scholary.spatialaudio.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Pipeline stages, in execution order. */
public enum StageName {
  SEPARATION("separation"),
  TRANSCRIPTION("transcription"),
  SPATIALIZE("spatialize");

  private final String id;

  StageName(String id) {
    this.id = id;
  }

  /** Name used in cache keys, artifact names and the job record. */
  @JsonValue
  public String id() {
    return id;
  }

  /** Artifact file holding this stage's payload. */
  public String artifactName() {
    return id + ".json";
  }

  @JsonCreator
  public static StageName fromId(String id) {
    for (StageName stage : values()) {
      if (stage.id.equals(id)) {
        return stage;
      }
    }
    throw new IllegalArgumentException("Unknown stage: " + id);
  }
}
