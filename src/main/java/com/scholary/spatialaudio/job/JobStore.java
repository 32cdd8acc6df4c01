package com.scholary.spatialaudio.job;

import com.fasterxml.jackson.databind.JsonNode;
import java.nio.file.Path;
import java.util.List;

/**
 * Per-job storage.
 *
 * <p>Each job owns an isolated directory holding the raw upload, stage artifacts and the job
 * record ({@value #JOB_RECORD}). Artifact names are always reduced to their base name, so callers
 * can never address a file outside the job directory.
 */
public interface JobStore {

  String JOB_RECORD = "job.json";

  /**
   * Allocate a new job with a fresh id and an empty directory.
   *
   * @return the job id
   */
  String createJob();

  /**
   * Persist the uploaded input.
   *
   * @return path of the stored file
   */
  Path saveUpload(String jobId, String filename, byte[] content);

  /** Write a JSON artifact (pretty-printed). */
  Path saveArtifact(String jobId, String name, JsonNode payload);

  /** Write a binary artifact. */
  Path saveArtifact(String jobId, String name, byte[] content);

  /**
   * Copy a file into the job directory.
   *
   * @param destName artifact name, or null to keep the source file name
   */
  Path copyArtifact(String jobId, Path source, String destName);

  /** Names of all files in the job directory except the job record, sorted. */
  List<String> listArtifacts(String jobId);

  /**
   * Read an artifact.
   *
   * @throws JobNotFoundException if the job or the artifact does not exist
   */
  byte[] readArtifact(String jobId, String name);

  /**
   * Resolve an artifact path without checking that it exists.
   *
   * @throws JobNotFoundException if the job does not exist
   */
  Path artifactPath(String jobId, String name);

  /** Persist the job record. */
  void saveJob(Job job);

  /**
   * Load a persisted job record.
   *
   * @throws JobNotFoundException if no record exists
   */
  Job loadJob(String jobId);

  /** Reduce a user-supplied name to its base component. */
  static String sanitizeName(String name) {
    if (name == null) {
      return "";
    }
    String normalized = name.replace('\\', '/');
    int slash = normalized.lastIndexOf('/');
    String base = slash >= 0 ? normalized.substring(slash + 1) : normalized;
    return base.equals(".") || base.equals("..") ? "" : base;
  }
}
