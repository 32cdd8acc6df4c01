package com.scholary.spatialaudio.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/**
 * The persisted record of one pipeline run.
 *
 * <p>Written once by the orchestrator at the end of the run. A failed job keeps every stage result
 * computed before the failure and lists whatever artifacts had been written.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Job(
    String jobId,
    JobStatus status,
    Instant createdAt,
    String inputFile,
    String inputDigest,
    String language,
    List<StageResult> stages,
    List<String> outputArtifacts,
    String error) {

  public Job {
    stages = stages == null ? List.of() : List.copyOf(stages);
    outputArtifacts = outputArtifacts == null ? List.of() : List.copyOf(outputArtifacts);
  }
}
