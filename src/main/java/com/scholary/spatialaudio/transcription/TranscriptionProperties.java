package com.scholary.spatialaudio.transcription;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the transcription service.
 *
 * <p>A blank {@code baseUrl} selects the placeholder service, which returns an empty transcript.
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
    String baseUrl,
    @NotBlank String model,
    @NotBlank String version,
    @Positive int connectTimeout,
    @Positive int readTimeout) {

  public boolean remote() {
    return baseUrl != null && !baseUrl.isBlank();
  }
}
