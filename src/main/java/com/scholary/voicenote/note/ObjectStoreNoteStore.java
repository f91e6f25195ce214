package com.scholary.voicenote.note;

import com.scholary.voicenote.objectstore.ObjectStoreClient;
import com.scholary.voicenote.objectstore.ObjectStoreException;
import com.scholary.voicenote.pipeline.PersistenceException;
import com.scholary.voicenote.recording.VoiceRecording;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notes to an S3-compatible bucket.
 *
 * <p>Key layout: {@code {keyPrefix}{recordingId}/{stem}_note.{format}}. Storage errors are
 * reported as {@link PersistenceException} so the orchestrator fails the run.
 */
public class ObjectStoreNoteStore implements NoteStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreNoteStore.class);

  private final ObjectStoreClient objectStoreClient;
  private final String bucket;
  private final String keyPrefix;
  private final String format;

  public ObjectStoreNoteStore(
      ObjectStoreClient objectStoreClient, String bucket, String keyPrefix, String format) {
    this.objectStoreClient = objectStoreClient;
    this.bucket = bucket;
    this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    this.format = format;
  }

  @Override
  public VoiceNote save(VoiceRecording recording, String text) {
    byte[] content = text.getBytes(StandardCharsets.UTF_8);
    String key =
        keyPrefix + recording.id() + "/" + NoteStore.fileName(recording.originalName(), format);

    try {
      objectStoreClient.putObject(
          bucket, key, new ByteArrayInputStream(content), content.length, contentType());
    } catch (ObjectStoreException e) {
      throw new PersistenceException("Failed to upload note " + key + ": " + e.getMessage(), e);
    }

    VoiceNote note =
        new VoiceNote(
            UUID.randomUUID().toString(),
            recording.id(),
            key,
            format,
            content.length,
            Instant.now());
    LOGGER.info(
        "Created note: bucket={}, key={}, id={}, size={} bytes",
        bucket,
        key,
        note.id(),
        content.length);
    return note;
  }

  @Override
  public String read(VoiceNote note) {
    try (InputStream stream = objectStoreClient.getObjectStream(bucket, note.location())) {
      return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    } catch (ObjectStoreException | IOException e) {
      throw new PersistenceException("Failed to read note " + note.location(), e);
    }
  }

  private String contentType() {
    return "md".equals(format)
        ? "text/markdown; charset=utf-8"
        : "text/plain; charset=utf-8";
  }
}
