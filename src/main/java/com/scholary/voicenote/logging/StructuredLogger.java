package com.scholary.voicenote.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event is logged with an {@code event_type} field and its own fields in the MDC, so log
 * lines of one run can be filtered by {@code runId} and by event.
 */
public class StructuredLogger {

  public static final String RUN_ID = "runId";
  public static final String RECORDING_ID = "recordingId";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log stage started event. */
  public void logStageStarted(String stage) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage);

      logger.info("Stage started: {}", stage);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage finished event. */
  public void logStageFinished(String stage, long elapsedMs) {
    try {
      MDC.put("event_type", "stage_finished");
      MDC.put("stage", stage);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Stage finished: {} in {}ms", stage, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage failed event. */
  public void logStageFailed(String stage, String errorType, String message) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("stage", stage);
      MDC.put("errorType", errorType);

      logger.error("Stage failed: {}, error={}, message={}", stage, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log one successful ASR attempt for a segment. */
  public void logSegmentTranscribed(
      int segmentIndex, int attempt, int maxAttempts, long transcribeMs, int characters) {
    try {
      MDC.put("event_type", "segment_transcribed");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));

      logger.info(
          "Segment transcribed: segment={}, attempt={}/{}, transcribe={}ms, chars={}",
          segmentIndex,
          attempt,
          maxAttempts,
          transcribeMs,
          characters);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription retry event. */
  public void logTranscribeRetry(
      int segmentIndex,
      int attempt,
      int maxAttempts,
      String errorType,
      String message,
      long backoffMs) {
    try {
      MDC.put("event_type", "transcribe_retry");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", errorType);
      MDC.put("backoffMs", String.valueOf(backoffMs));

      logger.warn(
          "Transcribe retry: segment={}, attempt={}/{}, error={}, message={}, backoff={}ms",
          segmentIndex,
          attempt,
          maxAttempts,
          errorType,
          message,
          backoffMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log transcription failure event. */
  public void logTranscribeFailed(
      int segmentIndex, int attempts, String errorType, String message) {
    try {
      MDC.put("event_type", "transcribe_failed");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorType", errorType);

      logger.error(
          "Transcribe failed: segment={}, attempts={}, error={}, message={}",
          segmentIndex,
          attempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log the summary of a finished run. */
  public void logRunReport(
      String status,
      String failedStage,
      Double durationSeconds,
      int totalSegments,
      int failedSegments,
      String segmentDetails,
      int mergedLength,
      String noteId,
      long elapsedMs) {
    try {
      MDC.put("event_type", "run_report");
      MDC.put("status", status);
      if (failedStage != null) {
        MDC.put("stage", failedStage);
      }
      MDC.put("durationSeconds", String.valueOf(durationSeconds));
      MDC.put("totalSegments", String.valueOf(totalSegments));
      MDC.put("failedSegments", String.valueOf(failedSegments));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Run report: status={}, failedStage={}, audio={}s, segments={}, failed={},"
              + " perSegment=[{}], mergedChars={}, noteId={}, elapsed={}ms",
          status,
          failedStage,
          durationSeconds,
          totalSegments,
          failedSegments,
          segmentDetails,
          mergedLength,
          noteId,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set run context in MDC. */
  public static void setRunContext(String runId, String recordingId) {
    MDC.put(RUN_ID, runId);
    MDC.put(RECORDING_ID, recordingId);
  }

  /** Clear run context from MDC. */
  public static void clearRunContext() {
    MDC.remove(RUN_ID);
    MDC.remove(RECORDING_ID);
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("elapsedMs");
    MDC.remove("segment_index");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("transcribeMs");
    MDC.remove("errorType");
    MDC.remove("backoffMs");
    MDC.remove("status");
    MDC.remove("durationSeconds");
    MDC.remove("totalSegments");
    MDC.remove("failedSegments");
  }
}
