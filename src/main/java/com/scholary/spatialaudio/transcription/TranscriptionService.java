package com.scholary.spatialaudio.transcription;

import java.nio.file.Path;
import java.util.Map;

/**
 * Interface for transcription services.
 *
 * <p>This abstraction allows us to swap transcription providers without changing the pipeline.
 */
public interface TranscriptionService {

  /**
   * Transcribe an audio file with word-level timing.
   *
   * @param audioFile the audio to transcribe (usually the isolated vocal stem)
   * @param language language hint, or null to let the service detect it
   * @return the transcript
   * @throws TranscriptionException if the service cannot be reached or rejects the request
   * @throws com.scholary.spatialaudio.stage.MalformedResponseException if the response is unusable
   */
  TranscriptionPayload transcribe(Path audioFile, String language);

  /** Parameters identifying this adapter in cache keys (provider, version, model, URL). */
  Map<String, Object> cacheParameters();
}
