package com.scholary.spatialaudio.api;

import com.scholary.spatialaudio.job.Job;
import com.scholary.spatialaudio.job.JobNotFoundException;
import com.scholary.spatialaudio.job.JobStore;
import com.scholary.spatialaudio.service.PipelineOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for the spatial audio pipeline.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting an audio file (runs the pipeline synchronously and returns the job)
 *   <li>Reading a job record
 *   <li>Downloading a job artifact
 * </ul>
 */
@RestController
@Tag(name = "Jobs", description = "Spatial audio enrichment pipeline")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);

  private final PipelineOrchestrator orchestrator;
  private final JobStore jobStore;
  private final UploadValidator uploadValidator;

  public JobController(
      PipelineOrchestrator orchestrator, JobStore jobStore, UploadValidator uploadValidator) {
    this.orchestrator = orchestrator;
    this.jobStore = jobStore;
    this.uploadValidator = uploadValidator;
  }

  @PostMapping(value = "/jobs", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Process audio",
      description =
          "Run separation, transcription and spatialize on the upload and return the job record")
  public ResponseEntity<Job> createJob(
      @RequestParam(value = "file", required = false) MultipartFile file,
      @RequestParam(value = "language", required = false) String language)
      throws IOException {
    uploadValidator.validate(file);
    LOGGER.info(
        "Job request: file={}, bytes={}, language={}",
        file.getOriginalFilename(),
        file.getSize(),
        language);

    String hint = language == null || language.isBlank() ? null : language.trim();
    Job job = orchestrator.process(file.getOriginalFilename(), file.getBytes(), hint);
    return ResponseEntity.ok(job);
  }

  @GetMapping("/jobs/{jobId}")
  @Operation(summary = "Get job", description = "Read a persisted job record")
  public ResponseEntity<Job> getJob(@PathVariable String jobId) {
    return ResponseEntity.ok(jobStore.loadJob(jobId));
  }

  @GetMapping("/jobs/{jobId}/artifact/{name}")
  @Operation(summary = "Get artifact", description = "Download one file from a job directory")
  public ResponseEntity<byte[]> getArtifact(
      @PathVariable String jobId, @PathVariable String name) {
    String artifact = JobStore.sanitizeName(name);
    byte[] content = jobStore.readArtifact(jobId, artifact);
    MediaType mediaType =
        artifact.endsWith(".json")
            ? MediaType.APPLICATION_JSON
            : MediaType.APPLICATION_OCTET_STREAM;
    return ResponseEntity.ok().contentType(mediaType).body(content);
  }

  @GetMapping("/health")
  @Operation(summary = "Health check")
  public Map<String, Boolean> health() {
    return Map.of("ok", true);
  }

  @ExceptionHandler(InvalidUploadException.class)
  public ResponseEntity<Map<String, String>> handleInvalidUpload(InvalidUploadException e) {
    LOGGER.warn("Rejected upload: {}", e.getMessage());
    return ResponseEntity.status(e.getStatus()).body(Map.of("error", e.getMessage()));
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(JobNotFoundException e) {
    return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
  }
}
