package com.scholary.spatialaudio.spatial;

import com.scholary.spatialaudio.transcription.WordTiming;

/** A transcript word together with its stable transcript index. */
public record IndexedWord(int index, String word, Double start, Double end, Double score) {

  static IndexedWord of(int index, WordTiming word) {
    return new IndexedWord(index, word.word(), word.start(), word.end(), word.score());
  }
}
