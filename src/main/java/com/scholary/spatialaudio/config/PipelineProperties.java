package com.scholary.spatialaudio.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the pipeline.
 *
 * <p>Controls where jobs and the cache live, the upload limit, and which stem feeds
 * transcription.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @NotBlank String dataDir,
    @Positive int maxUploadMb,
    @NotBlank String stem,
    @Valid @NotNull CacheProperties cache,
    @Valid @NotNull JobsProperties jobs) {

  public record CacheProperties(
      @Pattern(regexp = "filesystem|s3") String blobBackend, @Positive long memoryMaxEntries) {}

  public record JobsProperties(@Positive long recordCacheSize) {}

  public Path jobsDir() {
    return Path.of(dataDir).resolve("jobs");
  }

  public Path cacheDir() {
    return Path.of(dataDir).resolve("cache");
  }

  public long maxUploadBytes() {
    return maxUploadMb * 1024L * 1024L;
  }
}
