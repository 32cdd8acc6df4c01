package com.scholary.spatialaudio.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.spatialaudio.cache.ContentCache;
import com.scholary.spatialaudio.cache.FileSystemContentCache;
import com.scholary.spatialaudio.job.FileSystemJobStore;
import com.scholary.spatialaudio.job.JobStore;
import com.scholary.spatialaudio.objectstore.BlobStore;
import com.scholary.spatialaudio.objectstore.FileSystemBlobStore;
import com.scholary.spatialaudio.separation.PlaceholderSeparationService;
import com.scholary.spatialaudio.separation.SeparationClient;
import com.scholary.spatialaudio.separation.SeparationProperties;
import com.scholary.spatialaudio.separation.SeparationService;
import com.scholary.spatialaudio.spatial.GeminiPositionPredictor;
import com.scholary.spatialaudio.spatial.GeminiProperties;
import com.scholary.spatialaudio.spatial.PositionPredictor;
import com.scholary.spatialaudio.spatial.SpatialPositionSynthesizer;
import com.scholary.spatialaudio.spatial.SpatialProperties;
import com.scholary.spatialaudio.transcription.PlaceholderTranscriptionService;
import com.scholary.spatialaudio.transcription.TranscriptionProperties;
import com.scholary.spatialaudio.transcription.TranscriptionService;
import com.scholary.spatialaudio.transcription.WhisperXClient;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the pipeline: storage, cache and the stage services.
 *
 * <p>Separation and transcription fall back to placeholder services when no base URL is
 * configured, so the pipeline can run end to end without the model servers.
 */
@Configuration
@EnableConfigurationProperties({
  PipelineProperties.class,
  SeparationProperties.class,
  TranscriptionProperties.class,
  GeminiProperties.class,
  SpatialProperties.class
})
public class PipelineConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineConfig.class);

  @Bean
  public JobStore jobStore(PipelineProperties properties, ObjectMapper objectMapper) {
    return new FileSystemJobStore(
        properties.jobsDir(), objectMapper, properties.jobs().recordCacheSize());
  }

  @Bean
  @ConditionalOnProperty(
      name = "pipeline.cache.blob-backend",
      havingValue = "filesystem",
      matchIfMissing = true)
  public BlobStore fileSystemBlobStore(PipelineProperties properties) {
    return new FileSystemBlobStore(Path.of(properties.dataDir()));
  }

  @Bean
  public ContentCache contentCache(
      PipelineProperties properties, BlobStore blobStore, ObjectMapper objectMapper) {
    return new FileSystemContentCache(
        properties.cacheDir(), blobStore, objectMapper, properties.cache().memoryMaxEntries());
  }

  @Bean
  public SeparationService separationService(
      SeparationProperties properties, ObjectMapper objectMapper) {
    if (properties.remote()) {
      LOGGER.info("Using separation server at {}", properties.baseUrl());
      return new SeparationClient(properties, objectMapper);
    }
    LOGGER.warn("separation.base-url not set, using placeholder separation");
    return new PlaceholderSeparationService(properties);
  }

  @Bean
  public TranscriptionService transcriptionService(
      TranscriptionProperties properties, ObjectMapper objectMapper) {
    if (properties.remote()) {
      LOGGER.info("Using transcription server at {}", properties.baseUrl());
      return new WhisperXClient(properties, objectMapper);
    }
    LOGGER.warn("transcription.base-url not set, using placeholder transcription");
    return new PlaceholderTranscriptionService(properties);
  }

  @Bean
  public PositionPredictor positionPredictor(
      GeminiProperties properties, ObjectMapper objectMapper) {
    return new GeminiPositionPredictor(properties, objectMapper);
  }

  @Bean
  public SpatialPositionSynthesizer spatialPositionSynthesizer(
      PositionPredictor predictor, SpatialProperties properties) {
    return new SpatialPositionSynthesizer(predictor, properties);
  }
}
