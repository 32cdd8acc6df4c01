package com.scholary.spatialaudio.transcription;

import com.scholary.spatialaudio.stage.StagePayload;
import java.util.List;

/**
 * Transcription stage output.
 *
 * @param provider service that produced the transcript
 * @param model transcription model name
 * @param language detected or requested language, {@code unknown} if neither
 * @param text full transcript text
 * @param segments segment-level timing
 * @param words word-level timing, consumed by the spatialize stage
 */
public record TranscriptionPayload(
    String provider,
    String model,
    String language,
    String text,
    List<TranscriptSegment> segments,
    List<WordTiming> words)
    implements StagePayload {

  public TranscriptionPayload {
    text = text == null ? "" : text;
    segments = segments == null ? List.of() : List.copyOf(segments);
    words = words == null ? List.of() : List.copyOf(words);
  }
}
