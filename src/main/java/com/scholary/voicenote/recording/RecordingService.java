package com.scholary.voicenote.recording;

import com.scholary.voicenote.config.StorageProperties;
import com.scholary.voicenote.note.NoteStore;
import com.scholary.voicenote.pipeline.ProcessingStatus;
import com.scholary.voicenote.recording.InvalidAudioException.Code;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Accepts uploads and answers queries about recordings.
 *
 * <p>Uploads are validated before anything touches the disk: the part must be present, its MIME
 * type must be on the allow-list and its size must not exceed {@code storage.max-upload-bytes}.
 * Accepted files are stored as {@code {uploadDir}/yyyy/MM/dd/{id}.{ext}}.
 */
@Service
public class RecordingService {

  /** MIME types browsers and recorders send for the supported formats. */
  public static final Set<String> ACCEPTED_MIME_TYPES =
      Set.of(
          "audio/m4a",
          "audio/mp4",
          "audio/aac",
          "audio/ogg",
          "audio/wav",
          "audio/x-m4a",
          "audio/mpeg");

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordingService.class);

  private static final DateTimeFormatter DATE_PATH = DateTimeFormatter.ofPattern("yyyy/MM/dd");

  private final RecordingRepository recordingRepository;
  private final NoteStore noteStore;
  private final Path uploadDir;
  private final long maxUploadBytes;

  public RecordingService(
      RecordingRepository recordingRepository,
      NoteStore noteStore,
      StorageProperties storageProperties) {
    this.recordingRepository = recordingRepository;
    this.noteStore = noteStore;
    this.uploadDir = Paths.get(storageProperties.uploadDir());
    this.maxUploadBytes = storageProperties.maxUploadBytes();
  }

  /**
   * Validate and store an upload as a new recording with status UPLOADED.
   *
   * @param file the uploaded part, may be {@code null}
   * @return the saved recording
   * @throws InvalidAudioException if the upload is missing, has the wrong type or is too large
   */
  public VoiceRecording store(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new InvalidAudioException(Code.MISSING_AUDIO, "No audio file provided");
    }

    String mimeType = normalizeMimeType(file.getContentType());
    LOGGER.info(
        "Received audio file: {}, size: {} bytes, content_type: {}",
        file.getOriginalFilename(),
        file.getSize(),
        mimeType);

    if (!ACCEPTED_MIME_TYPES.contains(mimeType)) {
      throw new InvalidAudioException(
          Code.INVALID_MIME,
          String.format(
              "MIME type %s not accepted. Accepted types: %s",
              file.getContentType(), String.join(", ", new TreeSet<>(ACCEPTED_MIME_TYPES))));
    }
    if (file.getSize() > maxUploadBytes) {
      throw new InvalidAudioException(
          Code.TOO_LARGE,
          String.format(
              "File size %d exceeds maximum of %d bytes", file.getSize(), maxUploadBytes));
    }

    String id = UUID.randomUUID().toString();
    Path target =
        uploadDir
            .resolve(LocalDate.now(ZoneOffset.UTC).format(DATE_PATH))
            .resolve(id + extensionOf(file.getOriginalFilename()));

    try {
      Files.createDirectories(target.getParent());
      try (InputStream in = file.getInputStream()) {
        Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to store upload " + target, e);
    }

    VoiceRecording recording =
        recordingRepository.save(
            VoiceRecording.uploaded(
                id, originalNameOf(file), mimeType, file.getSize(), target));
    LOGGER.info("Stored voice recording {} at {}", id, target);
    return recording;
  }

  /**
   * Look up a recording.
   *
   * @throws RecordingNotFoundException if the id is unknown
   */
  public VoiceRecording get(String id) {
    return recordingRepository.findById(id).orElseThrow(() -> new RecordingNotFoundException(id));
  }

  /**
   * Remove a recording that will never be processed, together with its uploaded file.
   *
   * <p>A file that cannot be deleted is logged and left behind.
   */
  public void discard(String id) {
    recordingRepository
        .findById(id)
        .ifPresent(
            recording -> {
              recordingRepository.delete(id);
              try {
                Files.deleteIfExists(recording.audioPath());
              } catch (IOException e) {
                LOGGER.warn("Could not delete upload {}", recording.audioPath(), e);
              }
              LOGGER.info("Discarded recording {}", id);
            });
  }

  /**
   * Read the note of a finished recording.
   *
   * @throws RecordingNotFoundException if the id is unknown or the recording has no note
   * @throws NoteNotReadyException if the recording is not DONE
   */
  public String readNote(String id) {
    VoiceRecording recording = get(id);
    if (recording.status() != ProcessingStatus.DONE) {
      throw new NoteNotReadyException(id, recording.status());
    }
    if (recording.note() == null) {
      throw new RecordingNotFoundException(id);
    }
    return noteStore.read(recording.note());
  }

  private static String normalizeMimeType(String contentType) {
    if (contentType == null) {
      return "";
    }
    int semicolon = contentType.indexOf(';');
    String type = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
    return type.trim().toLowerCase(Locale.ROOT);
  }

  private static String originalNameOf(MultipartFile file) {
    String name = file.getOriginalFilename();
    return name == null || name.isBlank() ? "recording" : name;
  }

  private static String extensionOf(String filename) {
    if (filename == null) {
      return "";
    }
    int dot = filename.lastIndexOf('.');
    if (dot < 0 || dot == filename.length() - 1) {
      return "";
    }
    String extension = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    return extension.matches("[a-z0-9]{1,5}") ? "." + extension : "";
  }
}
