package com.scholary.spatialaudio.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.spatialaudio.config.PipelineProperties;
import com.scholary.spatialaudio.job.Job;
import com.scholary.spatialaudio.job.JobNotFoundException;
import com.scholary.spatialaudio.job.JobStatus;
import com.scholary.spatialaudio.job.JobStore;
import com.scholary.spatialaudio.service.PipelineOrchestrator;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class JobControllerTest {

  private static final String JOB_ID = "5f0c7e2a-3b9d-4c41-9a57-0d6f3f1f2b11";

  @Mock private PipelineOrchestrator orchestrator;
  @Mock private JobStore jobStore;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    PipelineProperties properties =
        new PipelineProperties(
            "./data",
            1,
            "vocals",
            new PipelineProperties.CacheProperties("filesystem", 10),
            new PipelineProperties.JobsProperties(10));
    JobController controller =
        new JobController(orchestrator, jobStore, new UploadValidator(properties));
    mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
  }

  private static Job completedJob() {
    return new Job(
        JOB_ID,
        JobStatus.COMPLETED,
        Instant.parse("2024-05-01T12:00:00Z"),
        "song.mp3",
        "abc123",
        "en",
        List.of(),
        List.of("separation.json", "song.mp3"),
        null);
  }

  @Test
  void createJob_shouldRunPipelineAndReturnJob() throws Exception {
    when(orchestrator.process(eq("song.mp3"), any(), eq("en"))).thenReturn(completedJob());

    mockMvc
        .perform(
            multipart("/jobs")
                .file(new MockMultipartFile("file", "song.mp3", "audio/mpeg", new byte[] {1, 2}))
                .param("language", " en "))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.jobId").value(JOB_ID))
        .andExpect(jsonPath("$.status").value("completed"))
        .andExpect(jsonPath("$.createdAt").value("2024-05-01T12:00:00Z"))
        .andExpect(jsonPath("$.outputArtifacts[1]").value("song.mp3"))
        .andExpect(jsonPath("$.error").doesNotExist());

    verify(orchestrator).process(eq("song.mp3"), eq(new byte[] {1, 2}), eq("en"));
  }

  @Test
  void createJob_shouldRejectEmptyUpload() throws Exception {
    mockMvc
        .perform(
            multipart("/jobs")
                .file(new MockMultipartFile("file", "song.mp3", "audio/mpeg", new byte[0])))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Uploaded file is empty"));

    verifyNoInteractions(orchestrator);
  }

  @Test
  void createJob_shouldRejectMissingFile() throws Exception {
    mockMvc.perform(multipart("/jobs")).andExpect(status().isBadRequest());

    verifyNoInteractions(orchestrator);
  }

  @Test
  void createJob_shouldRejectOversizedUpload() throws Exception {
    mockMvc
        .perform(
            multipart("/jobs")
                .file(new MockMultipartFile("file", "song.mp3", "audio/mpeg", new byte[1024 * 1024 + 1])))
        .andExpect(status().isPayloadTooLarge());

    verifyNoInteractions(orchestrator);
  }

  @Test
  void getJob_shouldReturnRecordOrNotFound() throws Exception {
    when(jobStore.loadJob(JOB_ID)).thenReturn(completedJob());
    when(jobStore.loadJob("missing")).thenThrow(new JobNotFoundException("Job not found: missing"));

    mockMvc
        .perform(get("/jobs/{id}", JOB_ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.inputDigest").value("abc123"));
    mockMvc.perform(get("/jobs/{id}", "missing")).andExpect(status().isNotFound());
  }

  @Test
  void getArtifact_shouldServeJsonAndBinaryArtifacts() throws Exception {
    when(jobStore.readArtifact(JOB_ID, "separation.json"))
        .thenReturn("{\"provider\":\"demucs\"}".getBytes(StandardCharsets.UTF_8));
    when(jobStore.readArtifact(JOB_ID, "vocals.wav")).thenReturn(new byte[] {7, 8});

    mockMvc
        .perform(get("/jobs/{id}/artifact/{name}", JOB_ID, "separation.json"))
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.provider").value("demucs"));
    mockMvc
        .perform(get("/jobs/{id}/artifact/{name}", JOB_ID, "vocals.wav"))
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.APPLICATION_OCTET_STREAM))
        .andExpect(content().bytes(new byte[] {7, 8}));
  }

  @Test
  void getArtifact_shouldReturnNotFoundForUnknownArtifact() throws Exception {
    when(jobStore.readArtifact(JOB_ID, "nope.json"))
        .thenThrow(new JobNotFoundException("Artifact not found: nope.json"));

    mockMvc
        .perform(get("/jobs/{id}/artifact/{name}", JOB_ID, "nope.json"))
        .andExpect(status().isNotFound());
  }

  @Test
  void health_shouldReportOk() throws Exception {
    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true));
  }
}
