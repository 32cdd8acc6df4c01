package com.scholary.spatialaudio.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.spatialaudio.objectstore.FileSystemBlobStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemContentCacheTest {

  @TempDir Path dataDir;

  private ObjectMapper objectMapper;
  private FileSystemContentCache cache;

  @BeforeEach
  void setUp() {
    objectMapper =
        JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    cache = newCache();
  }

  private FileSystemContentCache newCache() {
    return new FileSystemContentCache(
        dataDir.resolve("cache"), new FileSystemBlobStore(dataDir), objectMapper, 16);
  }

  @Test
  void get_shouldMissForUnknownKey() {
    assertThat(cache.get("separation-abc-def")).isEmpty();
  }

  @Test
  void put_shouldPersistEnvelopeReadableByFreshInstance() throws Exception {
    ObjectNode payload = objectMapper.createObjectNode().put("provider", "demucs");

    cache.put("separation-abc-def", payload);

    Path envelope = dataDir.resolve("cache/responses/separation-abc-def.json");
    assertThat(envelope).exists();
    JsonNode stored = objectMapper.readTree(Files.readAllBytes(envelope));
    assertThat(stored.path("cachedAt").isTextual()).isTrue();
    assertThat(stored.path("payload").equals(payload)).isTrue();

    Optional<CacheEntry> reloaded = newCache().get("separation-abc-def");
    assertThat(reloaded).isPresent();
    assertThat(reloaded.get().payload()).isEqualTo(payload);
    assertThat(reloaded.get().cachedAt()).isNotNull();
  }

  @Test
  void get_shouldTreatEnvelopeWithoutPayloadAsMiss() throws Exception {
    Path envelope = dataDir.resolve("cache/responses/transcription-abc-def.json");
    Files.writeString(envelope, "{\"cachedAt\":\"2024-01-01T00:00:00Z\"}");

    assertThat(cache.get("transcription-abc-def")).isEmpty();
  }

  @Test
  void put_shouldOverwriteExistingEntry() {
    cache.put("k", objectMapper.createObjectNode().put("v", 1));
    cache.put("k", objectMapper.createObjectNode().put("v", 2));

    assertThat(newCache().get("k").orElseThrow().payload().path("v").asInt()).isEqualTo(2);
  }

  @Test
  void blobs_shouldRoundTripUnderKeyNamespace() {
    byte[] archive = {1, 2, 3};

    cache.putBlob("separation-abc-def", "stems.zip", archive);

    assertThat(dataDir.resolve("cache/blobs/separation-abc-def/stems.zip")).exists();
    assertThat(cache.getBlob("separation-abc-def", "stems.zip")).contains(archive);
    assertThat(cache.getBlob("separation-abc-def", "vocals.wav")).isEmpty();
  }
}
