package com.scholary.spatialaudio.transcription;

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
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for a hosted WhisperX transcription API.
 *
 * <p>Sends the audio as multipart/form-data to {@code {baseUrl}/transcribe} with an optional
 * {@code language} field and parses the word-aligned transcript. Failures are not retried.
 */
public class WhisperXClient implements TranscriptionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperXClient.class);

  static final String PROVIDER = "whisperx";

  private final HttpClient httpClient;
  private final TranscriptionProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperXClient(TranscriptionProperties properties, ObjectMapper objectMapper) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build(),
        properties,
        objectMapper);
  }

  WhisperXClient(
      HttpClient httpClient, TranscriptionProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    LOGGER.info("Initialized WhisperX client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public TranscriptionPayload transcribe(Path audioFile, String language) {
    LOGGER.info("Transcribing: file={}, language={}", audioFile.getFileName(), language);

    HttpResponse<String> response;
    try {
      MultipartBody body =
          new MultipartBody()
              .addFile(
                  "file",
                  audioFile.getFileName().toString(),
                  "application/octet-stream",
                  Files.readAllBytes(audioFile));
      if (language != null) {
        body.addField("language", language);
      }

      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/transcribe"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", body.contentType())
              .POST(BodyPublishers.ofByteArray(body.toByteArray()))
              .build();

      LOGGER.debug("Sending transcription request to {}", request.uri());
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    } catch (IOException e) {
      throw new TranscriptionException("Transcription request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscriptionException("Transcription request interrupted", e);
    }

    if (response.statusCode() / 100 != 2) {
      throw new TranscriptionException(
          String.format(
              "Transcription API returned status %d: %s", response.statusCode(), response.body()));
    }

    TranscriptionPayload payload = parse(response.body(), language);
    LOGGER.info(
        "Transcription successful: {} segments, {} words, language={}",
        payload.segments().size(),
        payload.words().size(),
        payload.language());
    return payload;
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

  TranscriptionPayload parse(String body, String requestedLanguage) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new MalformedResponseException("Transcription response is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new MalformedResponseException("Transcription response is not a JSON object");
    }

    JsonNode wordsNode = root.get("words");
    if (wordsNode == null || !wordsNode.isArray()) {
      throw new MalformedResponseException("Transcription response missing words list");
    }

    List<WordTiming> words = new ArrayList<>();
    for (JsonNode word : wordsNode) {
      JsonNode text = word.get("word");
      if (text == null || !text.isTextual()) {
        throw new MalformedResponseException("Transcription word without text: " + word);
      }
      words.add(
          new WordTiming(
              text.asText(),
              optionalDouble(word, "start"),
              optionalDouble(word, "end"),
              optionalDouble(word, "score")));
    }

    List<TranscriptSegment> segments = new ArrayList<>();
    for (JsonNode segment : root.path("segments")) {
      if (!segment.path("start").isNumber() || !segment.path("end").isNumber()) {
        throw new MalformedResponseException("Transcription segment without timing: " + segment);
      }
      segments.add(
          new TranscriptSegment(
              segment.get("start").asDouble(),
              segment.get("end").asDouble(),
              segment.path("text").asText("")));
    }

    String language = root.path("language").asText(null);
    if (language == null || language.isBlank()) {
      language = requestedLanguage != null ? requestedLanguage : "unknown";
    }

    return new TranscriptionPayload(
        PROVIDER,
        root.path("model").asText(properties.model()),
        language,
        root.path("text").asText(""),
        segments,
        words);
  }

  private static Double optionalDouble(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && value.isNumber() ? value.asDouble() : null;
  }
}
