package com.scholary.voicenote.api;

import com.scholary.voicenote.recording.ProcessingCapacityException;
import com.scholary.voicenote.recording.RecordingProcessor;
import com.scholary.voicenote.recording.RecordingService;
import com.scholary.voicenote.recording.VoiceRecording;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for voice recordings.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Uploading a recording (processing starts asynchronously)
 *   <li>Status polling
 *   <li>Fetching the finished note
 * </ul>
 */
@RestController
@RequestMapping("/api/voices")
@Tag(name = "Voices", description = "Voice recording upload and transcription API")
public class VoiceController {

  private static final Logger LOGGER = LoggerFactory.getLogger(VoiceController.class);

  private static final MediaType TEXT_PLAIN_UTF8 =
      new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

  private final RecordingService recordingService;
  private final RecordingProcessor recordingProcessor;

  public VoiceController(
      RecordingService recordingService, RecordingProcessor recordingProcessor) {
    this.recordingService = recordingService;
    this.recordingProcessor = recordingProcessor;
  }

  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Upload a recording",
      description = "Store an audio file and start transcribing it in the background")
  public ResponseEntity<UploadResponse> upload(
      @RequestParam(value = "audio", required = false) MultipartFile audio) {
    VoiceRecording recording = recordingService.store(audio);
    try {
      recordingProcessor.processAsync(recording.id());
    } catch (TaskRejectedException e) {
      LOGGER.warn("Pipeline executor is full, discarding recording {}", recording.id());
      recordingService.discard(recording.id());
      throw new ProcessingCapacityException("Too many recordings in progress, try again later", e);
    }

    LOGGER.info("Accepted voice recording {}", recording.id());
    return ResponseEntity.accepted()
        .location(URI.create("/api/voices/" + recording.id()))
        .body(new UploadResponse(recording.id(), recording.status()));
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get recording", description = "Metadata and processing status")
  public RecordingResponse get(@PathVariable String id) {
    return RecordingResponse.from(recordingService.get(id));
  }

  @GetMapping("/{id}/note")
  @Operation(summary = "Get note", description = "The transcribed note of a finished recording")
  public ResponseEntity<String> note(@PathVariable String id) {
    return ResponseEntity.ok().contentType(TEXT_PLAIN_UTF8).body(recordingService.readNote(id));
  }
}
