package com.scholary.spatialaudio.separation;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Separation service used when no separation endpoint is configured.
 *
 * <p>Reports the standard four stems without producing audio, so transcription runs on the raw
 * upload.
 */
public class PlaceholderSeparationService implements SeparationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlaceholderSeparationService.class);

  static final String PROVIDER = "demucs-placeholder";

  private final SeparationProperties properties;

  public PlaceholderSeparationService(SeparationProperties properties) {
    this.properties = properties;
    LOGGER.warn("No separation endpoint configured, using placeholder stems");
  }

  @Override
  public SeparationResult separate(Path audioFile) {
    List<SeparationPayload.Stem> stems =
        List.of(
            new SeparationPayload.Stem("vocals", null),
            new SeparationPayload.Stem("drums", null),
            new SeparationPayload.Stem("bass", null),
            new SeparationPayload.Stem("other", null));
    return new SeparationResult(
        new SeparationPayload(
            PROVIDER, properties.model(), properties.version(), stems, null, null),
        null);
  }

  @Override
  public Map<String, Object> cacheParameters() {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("provider", PROVIDER);
    params.put("version", properties.version());
    return params;
  }
}
