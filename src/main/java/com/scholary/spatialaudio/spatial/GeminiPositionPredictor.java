package com.scholary.spatialaudio.spatial;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Predicts word positions with the Gemini {@code generateContent} API.
 *
 * <p>The chunk is sent as a JSON prompt describing the task, the output ranges and the context.
 * The model is asked for JSON only; Markdown code fences around the answer are tolerated. Rows
 * without a usable index or angle are dropped and left to the deterministic fallback.
 */
public class GeminiPositionPredictor implements PositionPredictor {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiPositionPredictor.class);

  static final String PROVIDER = "gemini-lyrics";

  private static final Pattern LEADING_FENCE = Pattern.compile("^```[a-zA-Z0-9_\\-]*\\s*\\n?");
  private static final Pattern TRAILING_FENCE = Pattern.compile("\\n?```\\s*$");

  private final HttpClient httpClient;
  private final GeminiProperties properties;
  private final ObjectMapper objectMapper;

  public GeminiPositionPredictor(GeminiProperties properties, ObjectMapper objectMapper) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build(),
        properties,
        objectMapper);
  }

  GeminiPositionPredictor(
      HttpClient httpClient, GeminiProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    if (!hasApiKey()) {
      LOGGER.warn("No Gemini API key configured, spatial positions will use the fallback curve");
    }
  }

  @Override
  public List<PredictedPosition> predict(ChunkRequest request) {
    if (!hasApiKey()) {
      throw new PredictionException("Gemini API key is not configured");
    }

    HttpResponse<String> response;
    try {
      HttpRequest httpRequest =
          HttpRequest.newBuilder()
              .uri(
                  URI.create(
                      properties.baseUrl()
                          + "/v1beta/models/"
                          + properties.model()
                          + ":generateContent"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "application/json")
              .header("x-goog-api-key", properties.apiKey())
              .POST(BodyPublishers.ofString(objectMapper.writeValueAsString(buildBody(request))))
              .build();

      LOGGER.debug(
          "Requesting positions: words={}, anchors={}",
          request.targets().size(),
          request.anchors().size());
      response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());

    } catch (IOException e) {
      throw new PredictionException("Gemini request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PredictionException("Gemini request interrupted", e);
    }

    if (response.statusCode() / 100 != 2) {
      throw new PredictionException(
          String.format("Gemini API returned status %d", response.statusCode()));
    }

    return parse(response.body());
  }

  @Override
  public String provider() {
    return PROVIDER;
  }

  @Override
  public String model() {
    return properties.model();
  }

  @Override
  public String method() {
    return WordPosition.METHOD_PREDICTED;
  }

  @Override
  public String version() {
    return properties.version();
  }

  private boolean hasApiKey() {
    return properties.apiKey() != null && !properties.apiKey().isBlank();
  }

  ObjectNode buildBody(ChunkRequest request) throws JsonProcessingException {
    ObjectNode prompt = objectMapper.createObjectNode();
    prompt.put("task", "Predict a 3D spatial position for every target lyric word for immersive audio.");
    ArrayNode rules = prompt.putArray("rules");
    rules.add("Return valid JSON only.");
    rules.add("Include one output object for every target index and no other indices.");
    rules.add("azimuthPi is the azimuth divided by pi, a float in [0,2).");
    rules.add("elevationPi is the angle from straight up divided by pi, a float in [0,1]; 0.5 is ear level.");
    rules.add("distance is a float in [0.25,3.0].");
    rules.add("confidence is a float in [0,1].");
    rules.add("Context words and previous positions are for continuity only.");
    prompt.put("language", request.language());
    prompt.set("targetWords", objectMapper.valueToTree(request.targets()));
    prompt.set("contextBefore", objectMapper.valueToTree(request.contextBefore()));
    prompt.set("contextAfter", objectMapper.valueToTree(request.contextAfter()));

    ArrayNode anchors = prompt.putArray("previousPositions");
    for (WordPosition anchor : request.anchors()) {
      PositionPi pi = anchor.position().positionPi();
      ObjectNode node = anchors.addObject();
      node.put("index", anchor.index());
      node.put("word", anchor.word());
      node.put("azimuthPi", pi.azimuthPi());
      node.put("elevationPi", pi.elevationPi());
      node.put("distance", pi.distance());
    }

    ObjectNode example = prompt.putObject("outputSchema").putArray("positions").addObject();
    example.put("index", 0);
    example.put("azimuthPi", 0.0);
    example.put("elevationPi", 0.5);
    example.put("distance", 1.0);
    example.put("confidence", 0.8);

    ObjectNode body = objectMapper.createObjectNode();
    ObjectNode content = body.putArray("contents").addObject();
    content.put("role", "user");
    content.putArray("parts").addObject().put("text", objectMapper.writeValueAsString(prompt));
    ObjectNode generationConfig = body.putObject("generationConfig");
    generationConfig.put("temperature", properties.temperature());
    generationConfig.put("responseMimeType", "application/json");
    return body;
  }

  List<PredictedPosition> parse(String responseBody) {
    String text;
    try {
      text =
          objectMapper
              .readTree(responseBody)
              .path("candidates")
              .path(0)
              .path("content")
              .path("parts")
              .path(0)
              .path("text")
              .asText("");
    } catch (JsonProcessingException e) {
      throw new PredictionException("Gemini response is not valid JSON", e);
    }
    if (text.isBlank()) {
      throw new PredictionException("Gemini returned empty content");
    }

    JsonNode parsed;
    try {
      parsed = objectMapper.readTree(stripCodeFences(text));
    } catch (JsonProcessingException e) {
      throw new PredictionException("Gemini content is not valid JSON", e);
    }

    JsonNode rows = parsed == null ? null : parsed.get("positions");
    if (rows == null || !rows.isArray() || rows.isEmpty()) {
      throw new PredictionException("Gemini response missing positions list");
    }

    List<PredictedPosition> positions = new ArrayList<>(rows.size());
    for (JsonNode row : rows) {
      if (!row.path("index").canConvertToInt()
          || !row.path("index").isIntegralNumber()
          || !row.path("azimuthPi").isNumber()
          || !row.path("elevationPi").isNumber()
          || !row.path("distance").isNumber()) {
        LOGGER.debug("Dropping incomplete position row: {}", row);
        continue;
      }
      positions.add(
          new PredictedPosition(
              row.get("index").asInt(),
              row.get("azimuthPi").asDouble(),
              row.get("elevationPi").asDouble(),
              row.get("distance").asDouble(),
              row.path("confidence").asDouble(0.5)));
    }
    return positions;
  }

  static String stripCodeFences(String text) {
    String cleaned = text.strip();
    if (cleaned.startsWith("```")) {
      cleaned = LEADING_FENCE.matcher(cleaned).replaceFirst("");
      cleaned = TRAILING_FENCE.matcher(cleaned).replaceFirst("");
    }
    return cleaned.strip();
  }
}
