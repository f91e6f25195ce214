package com.scholary.voicenote.asr;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.voicenote.segmentation.Segment;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for OpenAI-compatible Whisper transcription endpoints.
 *
 * <p>Sends one segment per request as multipart/form-data to {@code POST
 * {baseUrl}/audio/transcriptions} and returns the {@code text} field of the JSON response. Every
 * failure is classified:
 *
 * <ul>
 *   <li>transient: I/O errors, timeouts, HTTP 408, 409, 425, 429 and 5xx
 *   <li>permanent: other HTTP 4xx, a missing API key, an unreadable segment file, an unparseable
 *       response
 * </ul>
 *
 * <p>The body is assembled by hand because {@link HttpClient} has no multipart support; all text
 * parts are UTF-8 encoded so non-Latin prompts survive the trip.
 */
@Component
public class WhisperAsrClient implements AsrClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperAsrClient.class);

  private static final Set<Integer> RETRYABLE_CLIENT_ERRORS = Set.of(408, 409, 425, 429);

  private final HttpClient httpClient;
  private final AsrProperties properties;
  private final ObjectMapper objectMapper;
  private final URI endpoint;

  public WhisperAsrClient(AsrProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.endpoint = URI.create(stripTrailingSlash(properties.baseUrl()) + "/audio/transcriptions");

    this.httpClient = HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();

    LOGGER.info("Initialized ASR client: endpoint={}, model={}", endpoint, properties.model());
  }

  @Override
  public String transcribe(Segment segment, String prompt) {
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      throw new TranscriptionPermanentException("ASR API key is not configured");
    }

    byte[] audio;
    try {
      audio = Files.readAllBytes(segment.path());
    } catch (IOException e) {
      throw new TranscriptionPermanentException(
          "Cannot read segment file " + segment.path().getFileName(), e);
    }

    String boundary = UUID.randomUUID().toString();
    byte[] body = buildMultipartBody(segment.path(), audio, prompt, boundary);
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(endpoint)
            .timeout(properties.callTimeout())
            .header("Authorization", "Bearer " + properties.apiKey())
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(BodyPublishers.ofByteArray(body))
            .build();

    LOGGER.debug(
        "Sending segment {} ({} bytes) to {}", segment.index(), audio.length, request.uri());

    HttpResponse<String> response;
    try {
      response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (HttpTimeoutException e) {
      throw new TranscriptionTransientException(
          String.format("ASR call timed out after %ds", properties.callTimeout().toSeconds()), e);
    } catch (IOException e) {
      throw new TranscriptionTransientException("ASR call failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscriptionTransientException("ASR call interrupted", e);
    }

    int status = response.statusCode();
    if (status != 200) {
      String message =
          String.format("ASR API returned status %d: %s", status, abbreviate(response.body()));
      if (status >= 500 || RETRYABLE_CLIENT_ERRORS.contains(status)) {
        throw new TranscriptionTransientException(message);
      }
      throw new TranscriptionPermanentException(message);
    }

    return parseText(response.body());
  }

  private String parseText(String body) {
    WhisperTranscriptionResponse parsed;
    try {
      parsed = objectMapper.readValue(body, WhisperTranscriptionResponse.class);
    } catch (JsonProcessingException e) {
      throw new TranscriptionPermanentException(
          "Unparseable ASR response: " + abbreviate(body), e);
    }
    if (parsed == null || parsed.text() == null) {
      throw new TranscriptionPermanentException("ASR response has no text: " + abbreviate(body));
    }
    return parsed.text();
  }

  /**
   * Build a multipart/form-data body for the transcription request.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="segment_000.mp3"
   * Content-Type: audio/mpeg
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="model"
   *
   * whisper-1
   * ... prompt, language, response_format ...
   * --boundary--
   * </pre>
   */
  private byte[] buildMultipartBody(Path audioFile, byte[] audio, String prompt, String boundary) {
    String filename = audioFile.getFileName().toString();
    ByteArrayOutputStream body = new ByteArrayOutputStream(audio.length + 4096);

    StringBuilder header = new StringBuilder();
    header.append("--").append(boundary).append("\r\n");
    header
        .append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(filename)
        .append("\"\r\n");
    header.append("Content-Type: ").append(contentTypeFor(filename)).append("\r\n\r\n");
    body.writeBytes(header.toString().getBytes(StandardCharsets.UTF_8));
    body.writeBytes(audio);
    body.writeBytes("\r\n".getBytes(StandardCharsets.UTF_8));

    writeField(body, boundary, "model", properties.model());
    writeField(body, boundary, "prompt", prompt);
    writeField(body, boundary, "language", properties.language());
    writeField(body, boundary, "response_format", "json");

    body.writeBytes(("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
    return body.toByteArray();
  }

  private static void writeField(
      ByteArrayOutputStream body, String boundary, String name, String value) {
    String part =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\""
            + name
            + "\"\r\n\r\n"
            + value
            + "\r\n";
    body.writeBytes(part.getBytes(StandardCharsets.UTF_8));
  }

  private static String contentTypeFor(String filename) {
    String lower = filename.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".mp3")) {
      return "audio/mpeg";
    }
    if (lower.endsWith(".wav")) {
      return "audio/wav";
    }
    if (lower.endsWith(".flac")) {
      return "audio/flac";
    }
    return "application/octet-stream";
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  private static String abbreviate(String text) {
    if (text == null) {
      return "";
    }
    return text.length() <= 200 ? text : text.substring(0, 200) + "...";
  }
}
