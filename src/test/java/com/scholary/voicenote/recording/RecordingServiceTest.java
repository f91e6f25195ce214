package com.scholary.voicenote.recording;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.voicenote.config.StorageProperties;
import com.scholary.voicenote.note.NoteStore;
import com.scholary.voicenote.note.VoiceNote;
import com.scholary.voicenote.pipeline.ProcessingStatus;
import com.scholary.voicenote.recording.InvalidAudioException.Code;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

class RecordingServiceTest {

  @TempDir Path tempDir;

  private RecordingRepository repository;
  private NoteStore noteStore;
  private RecordingService service;

  @BeforeEach
  void setUp() {
    repository = new RecordingRepository(100, 24);
    noteStore = mock(NoteStore.class);
    StorageProperties properties =
        new StorageProperties(
            tempDir.resolve("voices").toString(),
            16,
            new StorageProperties.Notes("filesystem", tempDir.toString(), "txt", "notes/"));
    service = new RecordingService(repository, noteStore, properties);
  }

  @Test
  void store_shouldSaveFileAndCreateUploadedRecording() throws Exception {
    MockMultipartFile file =
        new MockMultipartFile("audio", "lecture.M4A", "audio/m4a", new byte[] {1, 2, 3});

    VoiceRecording recording = service.store(file);

    assertThat(recording.status()).isEqualTo(ProcessingStatus.UPLOADED);
    assertThat(recording.originalName()).isEqualTo("lecture.M4A");
    assertThat(recording.mimeType()).isEqualTo("audio/m4a");
    assertThat(recording.sizeBytes()).isEqualTo(3);
    assertThat(recording.audioPath()).startsWithRaw(tempDir.resolve("voices"));
    assertThat(recording.audioPath().getFileName().toString())
        .isEqualTo(recording.id() + ".m4a");
    assertThat(Files.readAllBytes(recording.audioPath())).containsExactly(1, 2, 3);
    assertThat(repository.findById(recording.id())).contains(recording);
  }

  @Test
  void store_shouldAcceptMimeTypeWithParameters() {
    MockMultipartFile file =
        new MockMultipartFile("audio", "memo.m4a", "Audio/X-M4A; codecs=aac", new byte[] {1});

    assertThat(service.store(file).mimeType()).isEqualTo("audio/x-m4a");
  }

  @Test
  void store_shouldRejectMissingFile() {
    assertThatThrownBy(() -> service.store(null))
        .isInstanceOfSatisfying(
            InvalidAudioException.class, e -> assertThat(e.code()).isEqualTo(Code.MISSING_AUDIO));
  }

  @Test
  void store_shouldRejectEmptyFile() {
    MockMultipartFile file = new MockMultipartFile("audio", "a.m4a", "audio/m4a", new byte[0]);

    assertThatThrownBy(() -> service.store(file))
        .isInstanceOfSatisfying(
            InvalidAudioException.class, e -> assertThat(e.code()).isEqualTo(Code.MISSING_AUDIO));
  }

  @Test
  void store_shouldRejectUnsupportedMimeType() {
    MockMultipartFile file =
        new MockMultipartFile("audio", "notes.pdf", "application/pdf", new byte[] {1});

    assertThatThrownBy(() -> service.store(file))
        .isInstanceOfSatisfying(
            InvalidAudioException.class, e -> assertThat(e.code()).isEqualTo(Code.INVALID_MIME))
        .hasMessageContaining("application/pdf");
  }

  @Test
  void store_shouldRejectOversizedFile() {
    MockMultipartFile file =
        new MockMultipartFile("audio", "long.m4a", "audio/m4a", new byte[17]);

    assertThatThrownBy(() -> service.store(file))
        .isInstanceOfSatisfying(
            InvalidAudioException.class, e -> assertThat(e.code()).isEqualTo(Code.TOO_LARGE));
    assertThat(tempDir.resolve("voices")).doesNotExist();
  }

  @Test
  void discard_shouldRemoveRecordingAndUploadedFile() {
    VoiceRecording recording =
        service.store(new MockMultipartFile("audio", "a.m4a", "audio/m4a", new byte[] {1}));

    service.discard(recording.id());

    assertThat(repository.findById(recording.id())).isEmpty();
    assertThat(recording.audioPath()).doesNotExist();
  }

  @Test
  void discard_shouldIgnoreUnknownId() {
    service.discard("missing");

    assertThat(repository.findById("missing")).isEmpty();
  }

  @Test
  void get_shouldThrowForUnknownId() {
    assertThatThrownBy(() -> service.get("missing"))
        .isInstanceOf(RecordingNotFoundException.class)
        .hasMessageContaining("missing");
  }

  @Test
  void readNote_shouldRejectUnfinishedRecording() {
    VoiceRecording processing =
        repository.save(uploaded().withStatus(ProcessingStatus.PROCESSING));

    assertThatThrownBy(() -> service.readNote(processing.id()))
        .isInstanceOfSatisfying(
            NoteNotReadyException.class,
            e -> assertThat(e.status()).isEqualTo(ProcessingStatus.PROCESSING));
    verifyNoInteractions(noteStore);
  }

  @Test
  void readNote_shouldRejectFailedRecording() {
    VoiceRecording failed =
        repository.save(
            uploaded()
                .withStatus(ProcessingStatus.PROCESSING)
                .withStatus(ProcessingStatus.FAILED));

    assertThatThrownBy(() -> service.readNote(failed.id()))
        .isInstanceOf(NoteNotReadyException.class);
  }

  @Test
  void readNote_shouldReturnStoredText() {
    VoiceNote note =
        new VoiceNote("n-1", "rec-1", "/notes/rec-1/a_note.txt", "txt", 8, Instant.now());
    VoiceRecording done =
        repository.save(
            uploaded()
                .withStatus(ProcessingStatus.PROCESSING)
                .withNote(note)
                .withStatus(ProcessingStatus.DONE));
    when(noteStore.read(note)).thenReturn("متن یادداشت");

    assertThat(service.readNote(done.id())).isEqualTo("متن یادداشت");
  }

  private static VoiceRecording uploaded() {
    return VoiceRecording.uploaded("rec-1", "a.m4a", "audio/m4a", 10, Path.of("/tmp/rec-1.m4a"));
  }
}
