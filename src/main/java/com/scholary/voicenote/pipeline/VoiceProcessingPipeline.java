package com.scholary.voicenote.pipeline;

import com.scholary.voicenote.config.PipelineProperties;
import com.scholary.voicenote.logging.StructuredLogger;
import com.scholary.voicenote.note.NoteStore;
import com.scholary.voicenote.note.VoiceNote;
import com.scholary.voicenote.probe.DurationProber;
import com.scholary.voicenote.recording.RecordingNotFoundException;
import com.scholary.voicenote.recording.RecordingRepository;
import com.scholary.voicenote.recording.VoiceRecording;
import com.scholary.voicenote.segmentation.FfmpegSegmenter;
import com.scholary.voicenote.segmentation.Segment;
import com.scholary.voicenote.segmentation.SegmentationException;
import com.scholary.voicenote.transcript.MergedTranscript;
import com.scholary.voicenote.transcript.TranscriptMerger;
import com.scholary.voicenote.transcription.TranscriptionOutcome;
import com.scholary.voicenote.transcription.TranscriptionWorkerPool;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives one recording from UPLOADED to DONE or FAILED.
 *
 * <p>Stages run in sequence: probe, split, transcribe, merge, save the note. Probe, split and
 * persistence failures end the run as FAILED; failed segments only put sentinels into the note.
 * The run's segment files are removed on every terminal transition.
 */
@Service
public class VoiceProcessingPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(VoiceProcessingPipeline.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final RecordingRepository recordingRepository;
  private final DurationProber durationProber;
  private final FfmpegSegmenter segmenter;
  private final TranscriptionWorkerPool workerPool;
  private final TranscriptMerger merger;
  private final NoteStore noteStore;
  private final boolean failWhenAllSegmentsFailed;

  public VoiceProcessingPipeline(
      RecordingRepository recordingRepository,
      DurationProber durationProber,
      FfmpegSegmenter segmenter,
      TranscriptionWorkerPool workerPool,
      TranscriptMerger merger,
      NoteStore noteStore,
      PipelineProperties properties) {
    this.recordingRepository = recordingRepository;
    this.durationProber = durationProber;
    this.segmenter = segmenter;
    this.workerPool = workerPool;
    this.merger = merger;
    this.noteStore = noteStore;
    this.failWhenAllSegmentsFailed = properties.failWhenAllSegmentsFailed();
  }

  /**
   * Process a stored recording.
   *
   * <p>Blocks until the run reaches a terminal status. Stage failures do not propagate; they are
   * reported through the returned run.
   *
   * @param recordingId id of an UPLOADED recording
   * @return the finished run
   * @throws RecordingNotFoundException if the recording does not exist
   * @throws IllegalStateException if the recording is not in status UPLOADED, including when
   *     another run has already started for it
   */
  public ProcessingRun process(String recordingId) {
    VoiceRecording processing =
        recordingRepository
            .update(recordingId, stored -> stored.withStatus(ProcessingStatus.PROCESSING))
            .orElseThrow(() -> new RecordingNotFoundException(recordingId));

    String runId = UUID.randomUUID().toString();
    StructuredLogger.setRunContext(runId, recordingId);
    Instant startedAt = Instant.now();
    long startTime = System.currentTimeMillis();

    try {
      LOGGER.info(
          "Starting run for {} ({}, {} bytes)",
          processing.originalName(),
          processing.mimeType(),
          processing.sizeBytes());
      RunState state = new RunState(processing);
      execute(state, runId);
      return finish(state, runId, startedAt, startTime);
    } finally {
      StructuredLogger.clearRunContext();
    }
  }

  private void execute(RunState state, String runId) {
    Stage current = Stage.PROBE;
    try {
      long stageStart = stageStarted(current);
      durationProber.verifyToolsAvailable();
      double duration = durationProber.probe(state.recording.audioPath());
      state.durationSeconds = duration;
      state.recording = persist(state.recording.withDuration(duration));
      stageFinished(current, stageStart);

      current = Stage.SEGMENTATION;
      stageStart = stageStarted(current);
      List<Segment> segments = segmenter.split(state.recording.audioPath(), duration, runId);
      if (segments.isEmpty()) {
        throw new SegmentationException("No segments produced for duration " + duration + "s");
      }
      state.segments = segments;
      stageFinished(current, stageStart);

      current = Stage.TRANSCRIPTION;
      stageStart = stageStarted(current);
      state.outcomes = workerPool.transcribeAll(segments);
      stageFinished(current, stageStart);

      current = Stage.MERGE;
      stageStart = stageStarted(current);
      MergedTranscript merged = merger.merge(state.outcomes);
      state.mergedText = merged.text();
      stageFinished(current, stageStart);
      if (merged.failedSegments() > 0) {
        LOGGER.warn(
            "Note contains {} failed segment markers out of {}",
            merged.failedSegments(),
            merged.totalSegments());
      }
      if (failWhenAllSegmentsFailed && merged.allFailed()) {
        throw new AllSegmentsFailedException(merged.totalSegments());
      }

      current = Stage.PERSISTENCE;
      stageStart = stageStarted(current);
      VoiceNote note = noteStore.save(state.recording, merged.text());
      state.recording = persist(state.recording.withNote(note).withStatus(ProcessingStatus.DONE));
      state.note = note;
      stageFinished(current, stageStart);

    } catch (PipelineStageException e) {
      fail(state, e.stage(), e);
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected error in stage {}", current, e);
      fail(state, current, e);
    } finally {
      cleanup(runId);
    }
  }

  private void cleanup(String runId) {
    try {
      int removed = segmenter.cleanup(runId);
      LOGGER.debug("Cleaned up {} segment files", removed);
    } catch (RuntimeException e) {
      LOGGER.warn("Could not clean up segment files of run {}", runId, e);
    }
  }

  private void fail(RunState state, Stage stage, RuntimeException error) {
    structuredLogger.logStageFailed(
        stage.name(), error.getClass().getSimpleName(), error.getMessage());
    state.failedStage = stage;
    state.errorMessage = error.getMessage();
    state.note = null;
    try {
      state.recording = persist(state.recording.withStatus(ProcessingStatus.FAILED));
    } catch (PersistenceException e) {
      LOGGER.error("Could not record FAILED status for {}", state.recording.id(), e);
    }
  }

  private ProcessingRun finish(RunState state, String runId, Instant startedAt, long startTime) {
    ProcessingStatus status =
        state.failedStage == null ? ProcessingStatus.DONE : ProcessingStatus.FAILED;
    ProcessingRun run =
        new ProcessingRun(
            runId,
            state.recording.id(),
            status,
            state.durationSeconds,
            state.segments.size(),
            state.outcomes,
            state.mergedText,
            state.note,
            state.failedStage,
            state.errorMessage,
            startedAt,
            Instant.now());

    structuredLogger.logRunReport(
        status.name(),
        state.failedStage == null ? null : state.failedStage.name(),
        state.durationSeconds,
        state.segments.size(),
        run.failedSegments(),
        describeSegments(state.segments, state.outcomes),
        state.mergedText == null ? 0 : state.mergedText.length(),
        state.note == null ? null : state.note.id(),
        System.currentTimeMillis() - startTime);
    return run;
  }

  private VoiceRecording persist(VoiceRecording recording) {
    try {
      return recordingRepository.save(recording);
    } catch (RuntimeException e) {
      throw new PersistenceException(
          "Failed to save recording " + recording.id() + " with status " + recording.status(), e);
    }
  }

  private long stageStarted(Stage stage) {
    structuredLogger.logStageStarted(stage.name());
    return System.currentTimeMillis();
  }

  private void stageFinished(Stage stage, long stageStart) {
    structuredLogger.logStageFinished(stage.name(), System.currentTimeMillis() - stageStart);
  }

  // e.g. "0:ok/1 extract=210ms asr=3400ms, 1:failed/3 extract=190ms asr=9100ms"
  static String describeSegments(List<Segment> segments, List<TranscriptionOutcome> outcomes) {
    Map<Integer, Long> extraction =
        segments.stream().collect(Collectors.toMap(Segment::index, Segment::extractionMs));
    return outcomes.stream()
        .map(
            o ->
                String.format(
                    Locale.ROOT,
                    "%d:%s/%d extract=%dms asr=%dms",
                    o.segmentIndex(),
                    o.isOk() ? "ok" : "failed",
                    o.attempts(),
                    extraction.getOrDefault(o.segmentIndex(), 0L),
                    o.elapsedMs()))
        .collect(Collectors.joining(", "));
  }

  /** Mutable bookkeeping of one run. */
  private static final class RunState {
    private VoiceRecording recording;
    private Double durationSeconds;
    private List<Segment> segments = List.of();
    private List<TranscriptionOutcome> outcomes = List.of();
    private String mergedText;
    private VoiceNote note;
    private Stage failedStage;
    private String errorMessage;

    private RunState(VoiceRecording recording) {
      this.recording = recording;
    }
  }
}
