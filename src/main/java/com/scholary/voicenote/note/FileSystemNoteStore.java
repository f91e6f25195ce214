package com.scholary.voicenote.note;

import com.scholary.voicenote.pipeline.PersistenceException;
import com.scholary.voicenote.recording.VoiceRecording;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notes as UTF-8 files below a local directory.
 *
 * <pre>
 * {directory}/{recordingId}/{stem}_note.txt
 * </pre>
 *
 * <p>The content goes to a temporary file first and is then moved into place, so a reader never
 * sees a partially written note.
 */
public class FileSystemNoteStore implements NoteStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemNoteStore.class);

  private final Path directory;
  private final String format;

  public FileSystemNoteStore(String directory, String format) {
    this.directory = Paths.get(directory);
    this.format = format;
  }

  @Override
  public VoiceNote save(VoiceRecording recording, String text) {
    byte[] content = text.getBytes(StandardCharsets.UTF_8);
    Path target =
        directory
            .resolve(recording.id())
            .resolve(NoteStore.fileName(recording.originalName(), format));

    try {
      Files.createDirectories(target.getParent());
      Path temp = Files.createTempFile(target.getParent(), ".note-", ".tmp");
      try {
        Files.write(temp, content);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      } finally {
        Files.deleteIfExists(temp);
      }
    } catch (IOException e) {
      throw new PersistenceException("Failed to write note to " + target, e);
    }

    VoiceNote note =
        new VoiceNote(
            UUID.randomUUID().toString(),
            recording.id(),
            target.toString(),
            format,
            content.length,
            Instant.now());
    LOGGER.info("Created note: {}, id={}, size={} bytes", target, note.id(), content.length);
    return note;
  }

  @Override
  public String read(VoiceNote note) {
    try {
      return new String(Files.readAllBytes(Paths.get(note.location())), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new PersistenceException("Failed to read note " + note.location(), e);
    }
  }
}
