package com.scholary.spatialaudio.cache;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Optional;

/**
 * Content-addressed cache for stage outputs.
 *
 * <p>Entries are keyed by stage, the digest of the job input, and the digest of every parameter
 * that affects the stage output (adapter version, URL, language, upstream content digest).
 * Changing any of those yields a different key, so entries never need invalidation.
 *
 * <p>Large binary outputs live in a parallel blob namespace under the same key, with a suffix per
 * blob (for example the raw stem archive and the extracted vocal track).
 *
 * <p>There is no locking: two jobs computing the same key concurrently both write, and the last
 * writer wins.
 */
public interface ContentCache {

  /**
   * Look up a cached payload.
   *
   * @param cacheKey key from {@link #generateKey}
   * @return the entry, or empty on a miss
   */
  Optional<CacheEntry> get(String cacheKey);

  /**
   * Store a payload, overwriting any existing entry.
   *
   * @param cacheKey key from {@link #generateKey}
   * @param payload the stage payload
   * @return the stored entry
   */
  CacheEntry put(String cacheKey, JsonNode payload);

  /**
   * Look up a blob stored under a cache key.
   *
   * @param cacheKey the owning cache key
   * @param suffix blob name within the key, e.g. {@code stems.zip}
   * @return the bytes, or empty on a miss
   */
  Optional<byte[]> getBlob(String cacheKey, String suffix);

  /**
   * Store a blob under a cache key.
   *
   * @param cacheKey the owning cache key
   * @param suffix blob name within the key
   * @param content the bytes
   */
  void putBlob(String cacheKey, String suffix, byte[] content);

  /**
   * Generate a cache key.
   *
   * <p>Format: {@code stage-inputDigest-sha256(canonicalJson(params))}.
   *
   * @param stage the stage name
   * @param inputDigest hex digest of the job input
   * @param params every parameter that affects the output; nulls are kept
   * @return a deterministic key
   */
  static String generateKey(String stage, String inputDigest, Map<String, ?> params) {
    return String.format(
        "%s-%s-%s", stage, inputDigest, ContentDigests.canonicalDigest(params));
  }
}
