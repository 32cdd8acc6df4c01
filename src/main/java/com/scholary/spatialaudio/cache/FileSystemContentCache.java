package com.scholary.spatialaudio.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.spatialaudio.objectstore.BlobStore;
import com.scholary.spatialaudio.objectstore.StorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ContentCache persisting response envelopes as JSON files.
 *
 * <p>Envelopes live at {@code <root>/responses/<key>.json}. Blobs are delegated to a {@link
 * BlobStore} under {@code cache/blobs/<key>/<suffix>}.
 *
 * <p>A bounded Caffeine layer keeps recently read envelopes in memory. Entries for a key never
 * change in content, so the layer needs no expiry.
 */
public class FileSystemContentCache implements ContentCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemContentCache.class);

  static final String BLOB_PREFIX = "cache/blobs/";

  private final Path responsesDir;
  private final BlobStore blobStore;
  private final ObjectMapper objectMapper;
  private final Cache<String, CacheEntry> memory;

  public FileSystemContentCache(
      Path root, BlobStore blobStore, ObjectMapper objectMapper, long memoryMaxEntries) {
    this.responsesDir = root.resolve("responses");
    this.blobStore = blobStore;
    this.objectMapper = objectMapper;
    this.memory = Caffeine.newBuilder().maximumSize(memoryMaxEntries).build();

    try {
      Files.createDirectories(responsesDir);
    } catch (IOException e) {
      throw new StorageException("Failed to create cache directory: " + responsesDir, e);
    }

    LOGGER.info(
        "Initialized content cache: responsesDir={}, memoryMaxEntries={}",
        responsesDir,
        memoryMaxEntries);
  }

  @Override
  public Optional<CacheEntry> get(String cacheKey) {
    CacheEntry cached = memory.getIfPresent(cacheKey);
    if (cached != null) {
      LOGGER.debug("Cache hit (memory): key={}", cacheKey);
      return Optional.of(cached);
    }

    Path path = envelopePath(cacheKey);
    JsonNode envelope;
    try {
      envelope = objectMapper.readTree(Files.readAllBytes(path));
    } catch (NoSuchFileException e) {
      LOGGER.debug("Cache miss: key={}", cacheKey);
      return Optional.empty();
    } catch (IOException e) {
      throw new StorageException("Failed to read cache entry: " + cacheKey, e);
    }

    JsonNode payload = envelope.get("payload");
    if (payload == null || !payload.isObject()) {
      LOGGER.warn("Ignoring cache entry without payload: key={}", cacheKey);
      return Optional.empty();
    }

    JsonNode cachedAt = envelope.path("cachedAt");
    CacheEntry entry =
        new CacheEntry(
            cacheKey,
            cachedAt.isTextual() ? Instant.parse(cachedAt.asText()) : null,
            payload);
    memory.put(cacheKey, entry);
    LOGGER.debug("Cache hit: key={}", cacheKey);
    return Optional.of(entry);
  }

  @Override
  public CacheEntry put(String cacheKey, JsonNode payload) {
    CacheEntry entry = new CacheEntry(cacheKey, Instant.now(), payload);

    ObjectNode envelope = objectMapper.createObjectNode();
    envelope.put("cachedAt", entry.cachedAt().toString());
    envelope.set("payload", payload);

    Path path = envelopePath(cacheKey);
    Path tmp = path.resolveSibling(path.getFileName() + "." + UUID.randomUUID() + ".tmp");
    try {
      Files.write(tmp, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(envelope));
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new StorageException("Failed to write cache entry: " + cacheKey, e);
    }

    memory.put(cacheKey, entry);
    LOGGER.debug("Cached payload: key={}", cacheKey);
    return entry;
  }

  @Override
  public Optional<byte[]> getBlob(String cacheKey, String suffix) {
    Optional<byte[]> blob = blobStore.get(blobName(cacheKey, suffix));
    LOGGER.debug("Blob {}: key={}, suffix={}", blob.isPresent() ? "hit" : "miss", cacheKey, suffix);
    return blob;
  }

  @Override
  public void putBlob(String cacheKey, String suffix, byte[] content) {
    blobStore.put(blobName(cacheKey, suffix), content, contentType(suffix));
    LOGGER.debug("Cached blob: key={}, suffix={}, bytes={}", cacheKey, suffix, content.length);
  }

  private Path envelopePath(String cacheKey) {
    return responsesDir.resolve(safeSegment(cacheKey) + ".json");
  }

  static String blobName(String cacheKey, String suffix) {
    return BLOB_PREFIX + safeSegment(cacheKey) + "/" + safeSegment(suffix);
  }

  private static String safeSegment(String value) {
    if (value.isEmpty() || value.contains("/") || value.contains("\\") || value.startsWith(".")) {
      throw new IllegalArgumentException("Invalid cache path segment: " + value);
    }
    return value;
  }

  private static String contentType(String suffix) {
    if (suffix.endsWith(".zip")) {
      return "application/zip";
    }
    if (suffix.endsWith(".wav")) {
      return "audio/wav";
    }
    return "application/octet-stream";
  }
}
