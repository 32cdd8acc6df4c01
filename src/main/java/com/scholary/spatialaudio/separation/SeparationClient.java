package com.scholary.spatialaudio.separation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.spatialaudio.http.MultipartBody;
import com.scholary.spatialaudio.stage.MalformedResponseException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for a hosted source separation API.
 *
 * <p>Posts the audio as multipart/form-data to {@code {baseUrl}/separate}. The service answers
 * either with a ZIP archive (one member per stem) or with JSON metadata only. There are no
 * retries: a failed call fails the stage.
 */
public class SeparationClient implements SeparationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SeparationClient.class);

  static final String PROVIDER = "demucs";

  private final HttpClient httpClient;
  private final SeparationProperties properties;
  private final ObjectMapper objectMapper;

  public SeparationClient(SeparationProperties properties, ObjectMapper objectMapper) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build(),
        properties,
        objectMapper);
  }

  SeparationClient(
      HttpClient httpClient, SeparationProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    LOGGER.info("Initialized separation client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public SeparationResult separate(Path audioFile) {
    LOGGER.info("Separating stems: file={}", audioFile.getFileName());

    HttpResponse<byte[]> response;
    try {
      MultipartBody body =
          new MultipartBody()
              .addFile(
                  "file",
                  audioFile.getFileName().toString(),
                  "application/octet-stream",
                  Files.readAllBytes(audioFile));

      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/separate"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", body.contentType())
              .POST(BodyPublishers.ofByteArray(body.toByteArray()))
              .build();

      LOGGER.debug("Sending separation request to {}", request.uri());
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());

    } catch (IOException e) {
      throw new SeparationException("Separation request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SeparationException("Separation request interrupted", e);
    }

    if (response.statusCode() / 100 != 2) {
      throw new SeparationException(
          String.format(
              "Separation API returned status %d: %s",
              response.statusCode(), abbreviate(response.body())));
    }

    String contentType =
        response.headers().firstValue("Content-Type").orElse("").toLowerCase(Locale.ROOT);

    SeparationResult result =
        contentType.contains("zip")
            ? fromArchive(response.body())
            : new SeparationResult(parseMetadata(response.body()), null);

    LOGGER.info(
        "Separation successful: stems={}, archiveBytes={}",
        result.metadata().stems().size(),
        result.hasArchive() ? result.stemsArchive().length : 0);
    return result;
  }

  @Override
  public Map<String, Object> cacheParameters() {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("provider", PROVIDER);
    params.put("model", properties.model());
    params.put("version", properties.version());
    params.put("url", properties.baseUrl());
    return params;
  }

  private SeparationResult fromArchive(byte[] archive) {
    List<SeparationPayload.Stem> stems = new ArrayList<>();
    for (String name : StemExtractor.stemNames(archive)) {
      stems.add(new SeparationPayload.Stem(name, null));
    }
    if (stems.isEmpty()) {
      throw new MalformedResponseException("Separation archive contains no stems");
    }
    return new SeparationResult(
        new SeparationPayload(
            PROVIDER, properties.model(), properties.version(), stems, null, null),
        archive);
  }

  private SeparationPayload parseMetadata(byte[] body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new MalformedResponseException("Separation response is not valid JSON", e);
    } catch (IOException e) {
      throw new MalformedResponseException("Separation response could not be read", e);
    }

    JsonNode stemsNode = root == null ? null : root.get("stems");
    if (stemsNode == null || !stemsNode.isArray()) {
      throw new MalformedResponseException("Separation response missing stems list");
    }

    List<SeparationPayload.Stem> stems = new ArrayList<>();
    for (JsonNode stem : stemsNode) {
      JsonNode name = stem.get("name");
      if (name == null || !name.isTextual()) {
        throw new MalformedResponseException("Separation response has a stem without a name");
      }
      JsonNode uri = stem.get("uri");
      stems.add(
          new SeparationPayload.Stem(
              name.asText(), uri != null && uri.isTextual() ? uri.asText() : null));
    }

    return new SeparationPayload(
        root.path("provider").asText(PROVIDER),
        root.path("model").asText(properties.model()),
        properties.version(),
        stems,
        null,
        null);
  }

  private static String abbreviate(byte[] body) {
    String text = new String(body, StandardCharsets.UTF_8);
    return text.length() > 200 ? text.substring(0, 200) + "..." : text;
  }
}
