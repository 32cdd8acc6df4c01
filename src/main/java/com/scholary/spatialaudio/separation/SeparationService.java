package com.scholary.spatialaudio.separation;

import java.nio.file.Path;
import java.util.Map;

/**
 * Interface for source separation services.
 *
 * <p>This abstraction lets us swap separation providers without changing the pipeline.
 */
public interface SeparationService {

  /**
   * Split an audio file into stems.
   *
   * @param audioFile the audio file
   * @return metadata and, optionally, the stem archive
   * @throws SeparationException if the service cannot be reached or rejects the request
   * @throws com.scholary.spatialaudio.stage.MalformedResponseException if the response is unusable
   */
  SeparationResult separate(Path audioFile);

  /** Parameters identifying this adapter in cache keys (provider, version, URL). */
  Map<String, Object> cacheParameters();
}
