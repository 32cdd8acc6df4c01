package com.scholary.spatialaudio.transcription;

/** A segment of transcribed audio with timing and text. */
public record TranscriptSegment(double start, double end, String text) {}
