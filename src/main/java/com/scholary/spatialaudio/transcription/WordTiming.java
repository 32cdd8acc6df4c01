package com.scholary.spatialaudio.transcription;

/**
 * A transcribed word with its timing.
 *
 * <p>Timing and score are nullable: aligners occasionally fail to place a word (numbers,
 * punctuation-only tokens) and report it without timestamps.
 *
 * @param word the word text
 * @param start start time in seconds
 * @param end end time in seconds
 * @param score alignment confidence in [0,1]
 */
public record WordTiming(String word, Double start, Double end, Double score) {

  public WordTiming {
    word = word == null ? "" : word;
  }
}
