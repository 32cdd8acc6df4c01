package com.scholary.spatialaudio.spatial;

import java.util.List;

/**
 * One chunk of a transcript sent to a predictor.
 *
 * <p>Only {@code targets} receive positions. The context words and anchors are there for
 * continuity and must not be repositioned.
 *
 * @param targets words to position
 * @param contextBefore words immediately preceding the chunk
 * @param contextAfter words immediately following the chunk
 * @param anchors the most recent positions already assigned, oldest first
 * @param language language hint, may be null
 */
public record ChunkRequest(
    List<IndexedWord> targets,
    List<IndexedWord> contextBefore,
    List<IndexedWord> contextAfter,
    List<WordPosition> anchors,
    String language) {

  public ChunkRequest {
    targets = List.copyOf(targets);
    contextBefore = List.copyOf(contextBefore);
    contextAfter = List.copyOf(contextAfter);
    anchors = List.copyOf(anchors);
  }
}
