package com.scholary.spatialaudio.spatial;

/** Cartesian position; {@code y} is vertical. */
public record PositionXyz(double x, double y, double z) {}
