package com.scholary.spatialaudio.spatial;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Gemini position predictor.
 *
 * <p>{@code apiKey} may be blank; every chunk then falls back to deterministic positions.
 */
@ConfigurationProperties(prefix = "gemini")
@Validated
public record GeminiProperties(
    String apiKey,
    @NotBlank String baseUrl,
    @NotBlank String model,
    @NotBlank String version,
    @DecimalMin("0.0") @DecimalMax("2.0") double temperature,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
