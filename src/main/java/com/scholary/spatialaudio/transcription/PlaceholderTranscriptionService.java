package com.scholary.spatialaudio.transcription;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Transcription service used when no transcription endpoint is configured. */
public class PlaceholderTranscriptionService implements TranscriptionService {

  private static final Logger LOGGER =
      LoggerFactory.getLogger(PlaceholderTranscriptionService.class);

  static final String PROVIDER = "whisperx-placeholder";

  private final TranscriptionProperties properties;

  public PlaceholderTranscriptionService(TranscriptionProperties properties) {
    this.properties = properties;
    LOGGER.warn("No transcription endpoint configured, using empty placeholder transcripts");
  }

  @Override
  public TranscriptionPayload transcribe(Path audioFile, String language) {
    return new TranscriptionPayload(
        PROVIDER,
        properties.model(),
        language != null ? language : "unknown",
        "",
        List.of(),
        List.of());
  }

  @Override
  public Map<String, Object> cacheParameters() {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("provider", PROVIDER);
    params.put("version", properties.version());
    return params;
  }
}
