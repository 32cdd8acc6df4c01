package com.scholary.spatialaudio.spatial;

/**
 * A raw position returned by a predictor, before normalization.
 *
 * @param index transcript index of the word
 * @param azimuthPi azimuth in multiples of π, any range
 * @param elevationPi polar angle in multiples of π, any range
 * @param distance distance, any range
 * @param confidence confidence, any range
 */
public record PredictedPosition(
    int index, double azimuthPi, double elevationPi, double distance, double confidence) {}
