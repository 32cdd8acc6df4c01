package com.scholary.spatialaudio.separation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the separation service.
 *
 * <p>A blank {@code baseUrl} selects the placeholder service, which reports stems without
 * producing audio.
 */
@ConfigurationProperties(prefix = "separation")
@Validated
public record SeparationProperties(
    String baseUrl,
    @NotBlank String model,
    @NotBlank String version,
    @Positive int connectTimeout,
    @Positive int readTimeout) {

  public boolean remote() {
    return baseUrl != null && !baseUrl.isBlank();
  }
}
