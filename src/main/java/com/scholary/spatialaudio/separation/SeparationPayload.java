package com.scholary.spatialaudio.separation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.spatialaudio.stage.StagePayload;
import java.util.List;

/**
 * Separation stage output.
 *
 * @param provider service that produced the stems
 * @param model separation model name
 * @param version adapter version, part of the cache key
 * @param stems stems reported by the service
 * @param archive job artifact holding the raw stem archive, if the service returned one
 * @param extractedStem job artifact holding the isolated stem, if one was extracted
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeparationPayload(
    String provider,
    String model,
    String version,
    List<Stem> stems,
    String archive,
    String extractedStem)
    implements StagePayload {

  public SeparationPayload {
    stems = stems == null ? List.of() : List.copyOf(stems);
  }

  /** Copy with the job artifact names filled in. */
  public SeparationPayload withArtifacts(String archive, String extractedStem) {
    return new SeparationPayload(provider, model, version, stems, archive, extractedStem);
  }

  /** A single stem; {@code uri} is set when the service hosts the stem itself. */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Stem(String name, String uri) {}
}
