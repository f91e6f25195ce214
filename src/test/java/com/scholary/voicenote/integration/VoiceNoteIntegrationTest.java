package com.scholary.voicenote.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.voicenote.asr.AsrClient;
import com.scholary.voicenote.asr.TranscriptionTransientException;
import com.scholary.voicenote.pipeline.ProcessingStatus;
import com.scholary.voicenote.probe.DurationProber;
import com.scholary.voicenote.probe.ProbeException;
import com.scholary.voicenote.process.ProcessResult;
import com.scholary.voicenote.process.ProcessRunner;
import com.scholary.voicenote.recording.RecordingRepository;
import com.scholary.voicenote.recording.VoiceRecording;
import com.scholary.voicenote.segmentation.Segment;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/**
 * Runs an upload through the whole application: HTTP layer, async executor, pipeline and the
 * filesystem note store.
 *
 * <p>ffmpeg, ffprobe and the ASR service are replaced by mocks, so the test needs neither the
 * media tools nor network access.
 */
@SpringBootTest(
    properties = {
      "pipeline.backoff-base=1ms",
      "pipeline.backoff-max=2ms",
      "asr.call-timeout=1ms",
      "pipeline.scratch-dir=${java.io.tmpdir}/voice-note-it/segments",
      "storage.upload-dir=${java.io.tmpdir}/voice-note-it/voices",
      "storage.notes.directory=${java.io.tmpdir}/voice-note-it/notes"
    })
@AutoConfigureMockMvc
class VoiceNoteIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;
  @Autowired private RecordingRepository recordingRepository;

  @MockBean private DurationProber durationProber;
  @MockBean private ProcessRunner processRunner;
  @MockBean private AsrClient asrClient;

  @BeforeEach
  void setUp() throws Exception {
    when(durationProber.probe(any())).thenReturn(200.0);
    when(processRunner.run(anyList(), any(Duration.class)))
        .thenAnswer(
            invocation -> {
              List<String> command = invocation.getArgument(0);
              Files.write(Paths.get(command.get(command.size() - 1)), new byte[] {1, 2, 3});
              return ProcessResult.completed(0, "");
            });
  }

  @Test
  void upload_shouldProduceNoteWithSentinelForFailedSegment() throws Exception {
    when(asrClient.transcribe(any(Segment.class), anyString()))
        .thenAnswer(
            invocation -> {
              Segment segment = invocation.getArgument(0);
              if (segment.index() == 1) {
                throw new TranscriptionTransientException("ASR API returned status 503");
              }
              return "  بخش   اول  ";
            });

    String id = upload();
    VoiceRecording finished = awaitTerminalStatus(id);

    assertThat(finished.status()).isEqualTo(ProcessingStatus.DONE);
    assertThat(finished.durationSeconds()).isEqualTo(200.0);
    mockMvc
        .perform(get("/api/voices/" + id + "/note"))
        .andExpect(status().isOk())
        .andExpect(content().string("بخش اول\n\n[SEGMENT FAILED]"));
    mockMvc
        .perform(get("/api/voices/" + id))
        .andExpect(jsonPath("$.status").value("DONE"))
        .andExpect(jsonPath("$.noteId").isNotEmpty());
  }

  @Test
  void upload_shouldEndFailedWhenProbeFails() throws Exception {
    when(durationProber.probe(any()))
        .thenThrow(new ProbeException("ffprobe failed"));

    String id = upload();
    VoiceRecording finished = awaitTerminalStatus(id);

    assertThat(finished.status()).isEqualTo(ProcessingStatus.FAILED);
    mockMvc
        .perform(get("/api/voices/" + id + "/note"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("NOT_READY"));
  }

  private String upload() throws Exception {
    MockMultipartFile audio =
        new MockMultipartFile("audio", "lecture.m4a", "audio/m4a", new byte[] {1, 2, 3, 4});
    MvcResult result =
        mockMvc
            .perform(multipart("/api/voices").file(audio))
            .andExpect(status().isAccepted())
            .andReturn();
    JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
    return body.get("id").asText();
  }

  private VoiceRecording awaitTerminalStatus(String id) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 10_000;
    while (System.currentTimeMillis() < deadline) {
      VoiceRecording recording = recordingRepository.findById(id).orElseThrow();
      if (recording.status().isTerminal()) {
        return recording;
      }
      Thread.sleep(20);
    }
    throw new AssertionError("Recording " + id + " did not finish in time");
  }
}
