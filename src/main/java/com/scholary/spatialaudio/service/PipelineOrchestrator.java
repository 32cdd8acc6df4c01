package com.scholary.spatialaudio.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.spatialaudio.cache.CacheEntry;
import com.scholary.spatialaudio.cache.ContentCache;
import com.scholary.spatialaudio.cache.ContentDigests;
import com.scholary.spatialaudio.config.PipelineProperties;
import com.scholary.spatialaudio.job.Job;
import com.scholary.spatialaudio.job.JobStatus;
import com.scholary.spatialaudio.job.JobStore;
import com.scholary.spatialaudio.job.StageName;
import com.scholary.spatialaudio.job.StageResult;
import com.scholary.spatialaudio.logging.StructuredLogger;
import com.scholary.spatialaudio.objectstore.StorageException;
import com.scholary.spatialaudio.separation.SeparationException;
import com.scholary.spatialaudio.separation.SeparationPayload;
import com.scholary.spatialaudio.separation.SeparationResult;
import com.scholary.spatialaudio.separation.SeparationService;
import com.scholary.spatialaudio.separation.StemExtractor;
import com.scholary.spatialaudio.spatial.SpatialPositionSynthesizer;
import com.scholary.spatialaudio.spatial.SpatialPrediction;
import com.scholary.spatialaudio.spatial.SpatialProperties;
import com.scholary.spatialaudio.spatial.SpatializePayload;
import com.scholary.spatialaudio.stage.MalformedResponseException;
import com.scholary.spatialaudio.stage.StageErrorKind;
import com.scholary.spatialaudio.stage.StageOutcome;
import com.scholary.spatialaudio.stage.StagePayload;
import com.scholary.spatialaudio.transcription.TranscriptionException;
import com.scholary.spatialaudio.transcription.TranscriptionPayload;
import com.scholary.spatialaudio.transcription.TranscriptionService;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs a submission through separation, transcription and (optionally) spatialize.
 *
 * <p>Stages run strictly in order on the calling thread. Before each stage the content cache is
 * consulted; on a miss the stage's service is called and its output cached. Every stage writes its
 * payload as a job artifact whether or not it hit the cache.
 *
 * <p>A stage failure stops the run. The job record is still written, with status {@code failed},
 * the error, and the results of every stage that completed.
 */
@Service
public class PipelineOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String ARCHIVE_BLOB = "stems.zip";
  static final String UPLOAD_PREFIX = "upload-";

  private final JobStore jobStore;
  private final ContentCache contentCache;
  private final SeparationService separationService;
  private final TranscriptionService transcriptionService;
  private final SpatialPositionSynthesizer synthesizer;
  private final ObjectMapper objectMapper;
  private final String stem;
  private final boolean spatializeEnabled;

  public PipelineOrchestrator(
      JobStore jobStore,
      ContentCache contentCache,
      SeparationService separationService,
      TranscriptionService transcriptionService,
      SpatialPositionSynthesizer synthesizer,
      ObjectMapper objectMapper,
      PipelineProperties pipelineProperties,
      SpatialProperties spatialProperties) {
    this.jobStore = jobStore;
    this.contentCache = contentCache;
    this.separationService = separationService;
    this.transcriptionService = transcriptionService;
    this.synthesizer = synthesizer;
    this.objectMapper = objectMapper;
    this.stem = pipelineProperties.stem();
    this.spatializeEnabled = spatialProperties.enabled();
  }

  /**
   * Process a submission.
   *
   * @param filename original file name; only the base name is kept
   * @param content the uploaded bytes, already validated as non-empty and within limits
   * @param language language hint, or null
   * @return the persisted job record, {@code completed} or {@code failed}
   * @throws StorageException if the job cannot be allocated or its record cannot be written
   */
  public Job process(String filename, byte[] content, String language) {
    String jobId = jobStore.createJob();
    Instant createdAt = Instant.now();
    String inputDigest = ContentDigests.sha256Hex(content);
    StructuredLogger.setJobContext(jobId, inputDigest);

    try {
      LOGGER.info(
          "Processing job: file={}, bytes={}, language={}", filename, content.length, language);

      Path upload;
      try {
        upload = jobStore.saveUpload(jobId, uploadName(filename), content);
      } catch (StorageException e) {
        LOGGER.error("Failed to store upload", e);
        RunContext run =
            new RunContext(
                jobId, createdAt, JobStore.sanitizeName(filename), inputDigest, language);
        return finish(
            run, "upload failed (" + StageErrorKind.STORAGE_FAILURE + "): " + e.getMessage());
      }
      RunContext run =
          new RunContext(
              jobId, createdAt, upload.getFileName().toString(), inputDigest, language);

      StageOutcome<SeparationPayload> separation =
          runStage(StageName.SEPARATION, () -> separate(jobId, inputDigest, upload));
      if (!appendResult(run, StageName.SEPARATION, separation)) {
        return finish(run, errorMessage(StageName.SEPARATION, separation));
      }

      String extractedStem = separation.payload().extractedStem();
      Path transcriptionInput =
          extractedStem != null ? jobStore.artifactPath(jobId, extractedStem) : upload;
      StageOutcome<TranscriptionPayload> transcription =
          runStage(
              StageName.TRANSCRIPTION,
              () ->
                  transcribe(
                      jobId, inputDigest, transcriptionInput, extractedStem != null, language));
      if (!appendResult(run, StageName.TRANSCRIPTION, transcription)) {
        return finish(run, errorMessage(StageName.TRANSCRIPTION, transcription));
      }

      if (spatializeEnabled) {
        StageOutcome<SpatializePayload> spatialize =
            runStage(
                StageName.SPATIALIZE,
                () -> spatialize(jobId, inputDigest, transcription.payload(), language));
        if (!appendResult(run, StageName.SPATIALIZE, spatialize)) {
          return finish(run, errorMessage(StageName.SPATIALIZE, spatialize));
        }
      }

      return finish(run, null);

    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private StageOutcome<SeparationPayload> separate(
      String jobId, String inputDigest, Path upload) {
    Map<String, Object> params = new LinkedHashMap<>(separationService.cacheParameters());
    params.put("stem", stem);
    String cacheKey =
        ContentCache.generateKey(StageName.SEPARATION.id(), inputDigest, params);
    structuredLogger.logStageStarted(StageName.SEPARATION.id(), cacheKey);

    Optional<SeparationPayload> cached = cachedPayload(cacheKey, SeparationPayload.class);
    if (cached.isPresent() && restoreSeparationBlobs(jobId, cacheKey, cached.get())) {
      saveStageArtifact(jobId, StageName.SEPARATION, cached.get());
      return StageOutcome.ok(cached.get(), true);
    }

    SeparationResult result = separationService.separate(upload);
    SeparationPayload payload = result.metadata();

    if (result.hasArchive()) {
      byte[] archive = result.stemsArchive();
      contentCache.putBlob(cacheKey, ARCHIVE_BLOB, archive);
      jobStore.saveArtifact(jobId, ARCHIVE_BLOB, archive);

      byte[] stemAudio = StemExtractor.extract(archive, stem);
      contentCache.putBlob(cacheKey, stemArtifact(), stemAudio);
      jobStore.saveArtifact(jobId, stemArtifact(), stemAudio);

      payload = payload.withArtifacts(ARCHIVE_BLOB, stemArtifact());
    }

    contentCache.put(cacheKey, objectMapper.valueToTree(payload));
    saveStageArtifact(jobId, StageName.SEPARATION, payload);
    return StageOutcome.ok(payload, false);
  }

  /**
   * Copy the cached blobs a separation payload refers to into the job directory.
   *
   * @return false if a referenced blob is gone, in which case the entry is treated as a miss
   */
  private boolean restoreSeparationBlobs(
      String jobId, String cacheKey, SeparationPayload payload) {
    List<String> names = new ArrayList<>();
    if (payload.archive() != null) {
      names.add(payload.archive());
    }
    if (payload.extractedStem() != null) {
      names.add(payload.extractedStem());
    }

    Map<String, byte[]> blobs = new LinkedHashMap<>();
    for (String name : names) {
      Optional<byte[]> blob = contentCache.getBlob(cacheKey, name);
      if (blob.isEmpty()) {
        LOGGER.warn("Cached separation blob missing, recomputing: key={}, blob={}", cacheKey, name);
        return false;
      }
      blobs.put(name, blob.get());
    }
    blobs.forEach((name, content) -> jobStore.saveArtifact(jobId, name, content));
    return true;
  }

  private StageOutcome<TranscriptionPayload> transcribe(
      String jobId, String inputDigest, Path audio, boolean fromStem, String language) {
    Map<String, Object> params = new LinkedHashMap<>(transcriptionService.cacheParameters());
    params.put("language", language);
    params.put("source", fromStem ? "stem:" + stem : "upload");
    String cacheKey =
        ContentCache.generateKey(StageName.TRANSCRIPTION.id(), inputDigest, params);
    structuredLogger.logStageStarted(StageName.TRANSCRIPTION.id(), cacheKey);

    Optional<TranscriptionPayload> cached = cachedPayload(cacheKey, TranscriptionPayload.class);
    if (cached.isPresent()) {
      saveStageArtifact(jobId, StageName.TRANSCRIPTION, cached.get());
      return StageOutcome.ok(cached.get(), true);
    }

    TranscriptionPayload payload = transcriptionService.transcribe(audio, language);
    contentCache.put(cacheKey, objectMapper.valueToTree(payload));
    saveStageArtifact(jobId, StageName.TRANSCRIPTION, payload);
    return StageOutcome.ok(payload, false);
  }

  private StageOutcome<SpatializePayload> spatialize(
      String jobId, String inputDigest, TranscriptionPayload transcript, String language) {
    String effectiveLanguage = language != null ? language : transcript.language();

    Map<String, Object> params = new LinkedHashMap<>();
    params.put("provider", synthesizer.predictor().provider());
    params.put("model", synthesizer.predictor().model());
    params.put("version", synthesizer.predictor().version());
    params.put("language", effectiveLanguage);
    params.put("wordsDigest", ContentDigests.canonicalDigest(transcript.words()));
    params.put("chunkSize", synthesizer.chunkSize());
    params.put("contextWords", synthesizer.contextWords());
    String cacheKey = ContentCache.generateKey(StageName.SPATIALIZE.id(), inputDigest, params);
    structuredLogger.logStageStarted(StageName.SPATIALIZE.id(), cacheKey);

    Optional<SpatializePayload> cached = cachedPayload(cacheKey, SpatializePayload.class);
    if (cached.isPresent()) {
      saveStageArtifact(jobId, StageName.SPATIALIZE, cached.get());
      return StageOutcome.ok(cached.get(), true);
    }

    SpatialPrediction prediction = synthesizer.predict(transcript.words(), effectiveLanguage);
    SpatializePayload payload =
        SpatializePayload.from(
            prediction,
            synthesizer.predictor().provider(),
            synthesizer.predictor().model(),
            effectiveLanguage);
    contentCache.put(cacheKey, objectMapper.valueToTree(payload));
    saveStageArtifact(jobId, StageName.SPATIALIZE, payload);
    return StageOutcome.ok(payload, false);
  }

  /** Run a stage, classifying any exception into a failed outcome. */
  private <T extends StagePayload> StageOutcome<T> runStage(
      StageName stage, Supplier<StageOutcome<T>> body) {
    long startTime = System.currentTimeMillis();
    StageOutcome<T> outcome;
    try {
      outcome = body.get();
    } catch (SeparationException | TranscriptionException e) {
      outcome = StageOutcome.failed(StageErrorKind.ADAPTER_FAILURE, e.getMessage());
      LOGGER.debug("Stage {} adapter failure", stage.id(), e);
    } catch (MalformedResponseException e) {
      outcome = StageOutcome.failed(StageErrorKind.MALFORMED_RESPONSE, e.getMessage());
      LOGGER.debug("Stage {} malformed response", stage.id(), e);
    } catch (StorageException | UncheckedIOException e) {
      outcome = StageOutcome.failed(StageErrorKind.STORAGE_FAILURE, e.getMessage());
      LOGGER.debug("Stage {} storage failure", stage.id(), e);
    } catch (RuntimeException e) {
      outcome = StageOutcome.failed(StageErrorKind.UNEXPECTED, e.toString());
      LOGGER.error("Unexpected error in stage {}", stage.id(), e);
    }

    if (outcome.isOk()) {
      structuredLogger.logStageFinished(
          stage.id(), outcome.cacheHit(), System.currentTimeMillis() - startTime);
    } else {
      structuredLogger.logStageFailed(
          stage.id(), outcome.errorKind().name(), outcome.errorMessage());
    }
    return outcome;
  }

  /** Append a successful outcome to the run's stage history; returns false for a failure. */
  private boolean appendResult(
      RunContext run, StageName stage, StageOutcome<? extends StagePayload> outcome) {
    if (!outcome.isOk()) {
      return false;
    }
    JsonNode payload = objectMapper.valueToTree(outcome.payload());
    run.stages().add(new StageResult(stage, outcome.cacheHit(), payload));
    return true;
  }

  private Job finish(RunContext run, String error) {
    JobStatus status = error == null ? JobStatus.COMPLETED : JobStatus.FAILED;
    Job job =
        new Job(
            run.jobId(),
            status,
            run.createdAt(),
            run.inputFile(),
            run.inputDigest(),
            run.language(),
            run.stages(),
            jobStore.listArtifacts(run.jobId()),
            error);
    jobStore.saveJob(job);

    LOGGER.info(
        "Job {}: stages={}, artifacts={}",
        status.id(),
        job.stages().size(),
        job.outputArtifacts().size());
    return job;
  }

  private <T extends StagePayload> Optional<T> cachedPayload(String cacheKey, Class<T> type) {
    Optional<CacheEntry> entry = contentCache.get(cacheKey);
    if (entry.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.treeToValue(entry.get().payload(), type));
    } catch (JsonProcessingException e) {
      LOGGER.warn("Ignoring unreadable cache entry: key={}, error={}", cacheKey, e.getMessage());
      return Optional.empty();
    }
  }

  private void saveStageArtifact(String jobId, StageName stage, StagePayload payload) {
    jobStore.saveArtifact(jobId, stage.artifactName(), objectMapper.valueToTree(payload));
  }

  private String stemArtifact() {
    return stem + ".wav";
  }

  /** Base name for the stored upload, prefixed when it would collide with a pipeline artifact. */
  String uploadName(String filename) {
    String safeName = JobStore.sanitizeName(filename);
    Set<String> reserved = new HashSet<>();
    reserved.add(JobStore.JOB_RECORD);
    reserved.add(ARCHIVE_BLOB);
    reserved.add(stemArtifact());
    for (StageName stage : StageName.values()) {
      reserved.add(stage.artifactName());
    }
    return reserved.contains(safeName) ? UPLOAD_PREFIX + safeName : safeName;
  }

  private static String errorMessage(StageName stage, StageOutcome<?> outcome) {
    return String.format(
        "%s failed (%s): %s", stage.id(), outcome.errorKind(), outcome.errorMessage());
  }

  /** Identity of one run and the stage results collected so far. */
  private record RunContext(
      String jobId,
      Instant createdAt,
      String inputFile,
      String inputDigest,
      String language,
      List<StageResult> stages) {

    RunContext(
        String jobId, Instant createdAt, String inputFile, String inputDigest, String language) {
      this(jobId, createdAt, inputFile, inputDigest, language, new ArrayList<>());
    }
  }
}
