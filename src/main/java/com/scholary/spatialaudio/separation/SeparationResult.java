package com.scholary.spatialaudio.separation;

/**
 * What a separation service returns.
 *
 * @param metadata stem metadata
 * @param stemsArchive ZIP archive with one member per stem, or null if the service returned
 *     metadata only
 */
public record SeparationResult(SeparationPayload metadata, byte[] stemsArchive) {

  public boolean hasArchive() {
    return stemsArchive != null && stemsArchive.length > 0;
  }
}
