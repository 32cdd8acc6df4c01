package com.scholary.spatialaudio.cache;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * A cached stage response.
 *
 * <p>The envelope persisted on disk is {@code {"cachedAt": ..., "payload": ...}}; the key is the
 * file name and is not repeated inside the envelope.
 */
public record CacheEntry(String key, Instant cachedAt, JsonNode payload) {}
