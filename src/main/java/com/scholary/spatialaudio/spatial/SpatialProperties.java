package com.scholary.spatialaudio.spatial;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the spatialize stage.
 *
 * <p>{@code chunkSize} below {@value SpatialPositionSynthesizer#MIN_CHUNK_SIZE} is raised to it.
 */
@ConfigurationProperties(prefix = "spatial")
@Validated
public record SpatialProperties(
    boolean enabled, @Min(1) int chunkSize, @PositiveOrZero int contextWords) {}
