package com.scholary.spatialaudio.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.scholary.spatialaudio.cache.FileSystemContentCache;
import com.scholary.spatialaudio.config.PipelineProperties;
import com.scholary.spatialaudio.job.FileSystemJobStore;
import com.scholary.spatialaudio.job.Job;
import com.scholary.spatialaudio.job.JobStatus;
import com.scholary.spatialaudio.job.StageName;
import com.scholary.spatialaudio.job.StageResult;
import com.scholary.spatialaudio.objectstore.FileSystemBlobStore;
import com.scholary.spatialaudio.separation.SeparationException;
import com.scholary.spatialaudio.separation.SeparationPayload;
import com.scholary.spatialaudio.separation.SeparationResult;
import com.scholary.spatialaudio.separation.SeparationService;
import com.scholary.spatialaudio.spatial.PositionPredictor;
import com.scholary.spatialaudio.spatial.PredictionException;
import com.scholary.spatialaudio.spatial.SpatialPositionSynthesizer;
import com.scholary.spatialaudio.spatial.SpatialProperties;
import com.scholary.spatialaudio.transcription.TranscriptionException;
import com.scholary.spatialaudio.transcription.TranscriptionPayload;
import com.scholary.spatialaudio.transcription.TranscriptionService;
import com.scholary.spatialaudio.transcription.WordTiming;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Runs the pipeline against real on-disk storage with mocked model services. */
@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

  private static final byte[] AUDIO = "fake mp3 bytes".getBytes(StandardCharsets.UTF_8);

  @Mock private SeparationService separationService;
  @Mock private TranscriptionService transcriptionService;
  @Mock private PositionPredictor predictor;

  @TempDir Path dataDir;

  private ObjectMapper objectMapper;
  private PipelineProperties pipelineProperties;
  private FileSystemJobStore jobStore;
  private FileSystemContentCache contentCache;

  @BeforeEach
  void setUp() {
    objectMapper =
        JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    pipelineProperties =
        new PipelineProperties(
            dataDir.toString(),
            10,
            "vocals",
            new PipelineProperties.CacheProperties("filesystem", 100),
            new PipelineProperties.JobsProperties(100));
    jobStore = new FileSystemJobStore(pipelineProperties.jobsDir(), objectMapper, 100);
    contentCache =
        new FileSystemContentCache(
            pipelineProperties.cacheDir(), new FileSystemBlobStore(dataDir), objectMapper, 100);
  }

  private PipelineOrchestrator orchestrator(boolean spatialize) {
    SpatialProperties spatialProperties = new SpatialProperties(spatialize, 12, 4);
    return new PipelineOrchestrator(
        jobStore,
        contentCache,
        separationService,
        transcriptionService,
        new SpatialPositionSynthesizer(predictor, spatialProperties),
        objectMapper,
        pipelineProperties,
        spatialProperties);
  }

  private static byte[] stemArchive(String... stems) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(out)) {
      for (String stem : stems) {
        zip.putNextEntry(new ZipEntry("htdemucs/song/" + stem + ".wav"));
        zip.write(stem.getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
      }
    }
    return out.toByteArray();
  }

  private void stubSeparation(byte[] archive) {
    when(separationService.cacheParameters())
        .thenReturn(Map.of("provider", "demucs", "version", "4"));
    SeparationPayload metadata =
        new SeparationPayload(
            "demucs",
            "htdemucs",
            "4",
            List.of(new SeparationPayload.Stem("vocals", null)),
            null,
            null);
    when(separationService.separate(any())).thenReturn(new SeparationResult(metadata, archive));
  }

  private void stubTranscription() {
    when(transcriptionService.cacheParameters())
        .thenReturn(Map.of("provider", "whisperx", "version", "3"));
    when(transcriptionService.transcribe(any(), eq("en")))
        .thenReturn(
            new TranscriptionPayload(
                "whisperx",
                "large-v3",
                "en",
                "a b c",
                List.of(),
                List.of(
                    new WordTiming("a", 0.0, 0.2, 0.9),
                    new WordTiming("b", 0.2, 0.5, 0.9),
                    new WordTiming("c", 0.5, 0.9, 0.9))));
  }

  private void stubPredictor() {
    when(predictor.provider()).thenReturn("gemini-lyrics");
    when(predictor.model()).thenReturn("gemini-2.0-flash");
    when(predictor.predict(any())).thenThrow(new PredictionException("no key"));
  }

  @Test
  void process_shouldRunAllStagesAndPersistArtifacts() throws IOException {
    stubSeparation(stemArchive("vocals", "drums"));
    stubTranscription();
    stubPredictor();

    Job job = orchestrator(true).process("song.mp3", AUDIO, "en");

    assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.error()).isNull();
    assertThat(job.inputFile()).isEqualTo("song.mp3");
    assertThat(job.stages())
        .extracting(StageResult::stage)
        .containsExactly(StageName.SEPARATION, StageName.TRANSCRIPTION, StageName.SPATIALIZE);
    assertThat(job.stages()).noneMatch(StageResult::cacheHit);
    assertThat(job.outputArtifacts())
        .containsExactly(
            "separation.json",
            "song.mp3",
            "spatialize.json",
            "stems.zip",
            "transcription.json",
            "vocals.wav");
    assertThat(jobStore.readArtifact(job.jobId(), "vocals.wav"))
        .isEqualTo("vocals".getBytes(StandardCharsets.UTF_8));
    assertThat(jobStore.loadJob(job.jobId()).status()).isEqualTo(JobStatus.COMPLETED);

    ArgumentCaptor<Path> transcribed = ArgumentCaptor.forClass(Path.class);
    verify(transcriptionService).transcribe(transcribed.capture(), eq("en"));
    assertThat(transcribed.getValue().getFileName().toString()).isEqualTo("vocals.wav");

    StageResult spatialize = job.stages().get(2);
    assertThat(spatialize.payload().path("wordCount").asInt()).isEqualTo(3);
    assertThat(spatialize.payload().path("fallbackChunks").asInt()).isEqualTo(1);
    assertThat(spatialize.payload().path("provider").asText()).isEqualTo("gemini-lyrics");
  }

  @Test
  void process_shouldServeRepeatedInputFromCache() throws IOException {
    stubSeparation(stemArchive("vocals"));
    stubTranscription();
    stubPredictor();
    PipelineOrchestrator orchestrator = orchestrator(true);

    Job first = orchestrator.process("song.mp3", AUDIO, "en");
    Job second = orchestrator.process("renamed.mp3", AUDIO, "en");

    assertThat(second.jobId()).isNotEqualTo(first.jobId());
    assertThat(second.inputDigest()).isEqualTo(first.inputDigest());
    assertThat(second.stages()).allMatch(StageResult::cacheHit);
    for (int i = 0; i < first.stages().size(); i++) {
      assertThat(second.stages().get(i).payload()).isEqualTo(first.stages().get(i).payload());
    }
    assertThat(second.outputArtifacts()).contains("stems.zip", "vocals.wav", "renamed.mp3");

    verify(separationService, times(1)).separate(any());
    verify(transcriptionService, times(1)).transcribe(any(), any());
    verify(predictor, times(1)).predict(any());
  }

  @Test
  void process_shouldKeepCompletedStagesWhenTranscriptionFails() throws IOException {
    stubSeparation(stemArchive("vocals"));
    when(transcriptionService.cacheParameters()).thenReturn(Map.of("provider", "whisperx"));
    when(transcriptionService.transcribe(any(), any()))
        .thenThrow(new TranscriptionException("Transcription API returned status 500: boom"));

    Job job = orchestrator(true).process("song.mp3", AUDIO, null);

    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.error())
        .isEqualTo(
            "transcription failed (ADAPTER_FAILURE): Transcription API returned status 500: boom");
    assertThat(job.stages()).extracting(StageResult::stage).containsExactly(StageName.SEPARATION);
    assertThat(job.outputArtifacts())
        .contains("separation.json", "stems.zip", "vocals.wav", "song.mp3")
        .doesNotContain("transcription.json", "spatialize.json");
    assertThat(jobStore.loadJob(job.jobId())).isEqualTo(job);
    verifyNoInteractions(predictor);
  }

  @Test
  void process_shouldFailSeparationWhenArchiveLacksStem() throws IOException {
    stubSeparation(stemArchive("drums", "bass"));

    Job job = orchestrator(true).process("song.mp3", AUDIO, null);

    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.error()).startsWith("separation failed (MALFORMED_RESPONSE): ");
    assertThat(job.stages()).isEmpty();
    assertThat(job.outputArtifacts()).contains("song.mp3", "stems.zip");
    verifyNoInteractions(transcriptionService);
  }

  @Test
  void process_shouldRecordAdapterFailureOfSeparation() {
    when(separationService.cacheParameters()).thenReturn(Map.of("provider", "demucs"));
    when(separationService.separate(any())).thenThrow(new SeparationException("refused"));

    Job job = orchestrator(true).process("song.mp3", AUDIO, null);

    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.error()).isEqualTo("separation failed (ADAPTER_FAILURE): refused");
    assertThat(job.outputArtifacts()).containsExactly("song.mp3");
  }

  @Test
  void process_shouldTranscribeUploadWhenNoStemWasExtracted() {
    stubSeparation(null);
    stubTranscription();

    Job job = orchestrator(false).process("song.mp3", AUDIO, "en");

    assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.stages())
        .extracting(StageResult::stage)
        .containsExactly(StageName.SEPARATION, StageName.TRANSCRIPTION);
    assertThat(job.outputArtifacts())
        .containsExactly("separation.json", "song.mp3", "transcription.json");

    ArgumentCaptor<Path> transcribed = ArgumentCaptor.forClass(Path.class);
    verify(transcriptionService).transcribe(transcribed.capture(), eq("en"));
    assertThat(transcribed.getValue().getFileName().toString()).isEqualTo("song.mp3");
    verifyNoInteractions(predictor);
  }

  @Test
  void process_shouldNotLetUploadNamedLikeAnArtifactBeOverwritten() throws IOException {
    stubSeparation(stemArchive("vocals"));
    stubTranscription();
    byte[] upload = "ORIGINAL-UPLOAD".getBytes(StandardCharsets.UTF_8);

    Job job = orchestrator(false).process("vocals.wav", upload, "en");

    assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.inputFile()).isEqualTo("upload-vocals.wav");
    assertThat(jobStore.readArtifact(job.jobId(), "upload-vocals.wav")).isEqualTo(upload);
    assertThat(jobStore.readArtifact(job.jobId(), "vocals.wav"))
        .isEqualTo("vocals".getBytes(StandardCharsets.UTF_8));
    assertThat(job.outputArtifacts())
        .containsExactly(
            "separation.json", "stems.zip", "transcription.json", "upload-vocals.wav", "vocals.wav");
  }

  @Test
  void uploadName_shouldPrefixEveryNameThePipelineWrites() {
    PipelineOrchestrator orchestrator = orchestrator(true);

    assertThat(orchestrator.uploadName("stems.zip")).isEqualTo("upload-stems.zip");
    assertThat(orchestrator.uploadName("separation.json")).isEqualTo("upload-separation.json");
    assertThat(orchestrator.uploadName("transcription.json"))
        .isEqualTo("upload-transcription.json");
    assertThat(orchestrator.uploadName("spatialize.json")).isEqualTo("upload-spatialize.json");
    assertThat(orchestrator.uploadName("job.json")).isEqualTo("upload-job.json");
    assertThat(orchestrator.uploadName("../dir/vocals.wav")).isEqualTo("upload-vocals.wav");
    assertThat(orchestrator.uploadName("song.mp3")).isEqualTo("song.mp3");
  }

  @Test
  void process_shouldRecomputeSpatializeWhenTranscriptChanges() throws IOException {
    stubSeparation(stemArchive("vocals"));
    stubPredictor();
    when(transcriptionService.cacheParameters())
        .thenReturn(
            Map.of("provider", "whisperx", "version", "3"),
            Map.of("provider", "whisperx", "version", "4"));
    when(transcriptionService.transcribe(any(), eq("en")))
        .thenReturn(
            new TranscriptionPayload(
                "whisperx",
                "large-v3",
                "en",
                "a b",
                List.of(),
                List.of(new WordTiming("a", 0.0, 0.2, 0.9), new WordTiming("b", 0.2, 0.5, 0.9))),
            new TranscriptionPayload(
                "whisperx",
                "large-v3",
                "en",
                "a c",
                List.of(),
                List.of(new WordTiming("a", 0.0, 0.2, 0.9), new WordTiming("c", 0.2, 0.5, 0.9))));
    PipelineOrchestrator orchestrator = orchestrator(true);

    Job first = orchestrator.process("song.mp3", AUDIO, "en");
    Job second = orchestrator.process("song.mp3", AUDIO, "en");

    assertThat(second.inputDigest()).isEqualTo(first.inputDigest());
    assertThat(second.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(second.stages())
        .extracting(StageResult::cacheHit)
        .containsExactly(true, false, false);
    assertThat(second.stages().get(2).payload()).isNotEqualTo(first.stages().get(2).payload());
    verify(transcriptionService, times(2)).transcribe(any(), eq("en"));
    verify(predictor, times(2)).predict(any());
  }
}
