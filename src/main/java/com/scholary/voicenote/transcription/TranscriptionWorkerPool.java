package com.scholary.voicenote.transcription;

import com.scholary.voicenote.asr.AsrClient;
import com.scholary.voicenote.asr.TranscriptionPermanentException;
import com.scholary.voicenote.config.PipelineProperties;
import com.scholary.voicenote.logging.StructuredLogger;
import com.scholary.voicenote.segmentation.Segment;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * Transcribes the segments of a run with a bounded number of concurrent ASR calls.
 *
 * <p>Every call to {@link #transcribeAll(List)} gets its own fixed pool of at most {@code
 * pipeline.max-concurrency} threads, so no more than that many ASR calls of one run are ever in
 * flight. Each segment is retried independently:
 *
 * <ul>
 *   <li>a permanent error fails the segment at once
 *   <li>any other error is retried after an exponential backoff, up to {@code
 *       pipeline.max-attempts} attempts in total
 * </ul>
 *
 * <p>A failing segment never affects its siblings. The result holds exactly one outcome per
 * segment, sorted by segment index.
 */
@Component
public class TranscriptionWorkerPool {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionWorkerPool.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final AsrClient asrClient;
  private final RetryPolicy retryPolicy;
  private final int maxConcurrency;
  private final String prompt;
  private final Sleeper sleeper;

  @Autowired
  public TranscriptionWorkerPool(AsrClient asrClient, PipelineProperties properties) {
    this(asrClient, properties, Sleeper.THREAD_SLEEP);
  }

  public TranscriptionWorkerPool(
      AsrClient asrClient, PipelineProperties properties, Sleeper sleeper) {
    this.asrClient = asrClient;
    this.retryPolicy =
        new RetryPolicy(
            properties.maxAttempts(), properties.backoffBase(), properties.backoffMax());
    this.maxConcurrency = properties.maxConcurrency();
    this.prompt = properties.prompt();
    this.sleeper = sleeper;
  }

  /**
   * Transcribe every segment.
   *
   * <p>Blocks until each segment has a terminal outcome. If the calling thread is interrupted,
   * pending work is cancelled and every segment without a result is reported as failed.
   *
   * @param segments the segments of one run
   * @return one outcome per segment, in index order
   */
  public List<TranscriptionOutcome> transcribeAll(List<Segment> segments) {
    if (segments.isEmpty()) {
      return List.of();
    }

    int workers = Math.min(maxConcurrency, segments.size());
    LOGGER.info(
        "Transcribing {} segments with {} workers, max {} attempts each",
        segments.size(),
        workers,
        retryPolicy.maxAttempts());

    ExecutorService executor =
        Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("asr-worker-"));
    Map<String, String> context = MDC.getCopyOfContextMap();

    List<TranscriptionOutcome> outcomes = new ArrayList<>(segments.size());
    try {
      List<Future<TranscriptionOutcome>> futures = new ArrayList<>(segments.size());
      for (Segment segment : segments) {
        futures.add(executor.submit(() -> runWithContext(context, segment)));
      }

      boolean interrupted = false;
      for (int i = 0; i < segments.size(); i++) {
        Segment segment = segments.get(i);
        Future<TranscriptionOutcome> future = futures.get(i);
        if (interrupted) {
          outcomes.add(collectAfterInterrupt(future, segment));
          continue;
        }
        try {
          outcomes.add(future.get());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          interrupted = true;
          LOGGER.warn("Transcription interrupted, cancelling remaining segments");
          executor.shutdownNow();
          outcomes.add(collectAfterInterrupt(future, segment));
        } catch (ExecutionException e) {
          LOGGER.error("Worker for segment {} crashed", segment.index(), e.getCause());
          outcomes.add(TranscriptionOutcome.failed(segment.index(), 0, describe(e.getCause())));
        }
      }
    } finally {
      executor.shutdownNow();
    }

    outcomes.sort(Comparator.comparingInt(TranscriptionOutcome::segmentIndex));
    long failed = outcomes.stream().filter(TranscriptionOutcome::isFailed).count();
    LOGGER.info(
        "Transcription finished: {}/{} segments ok, {} failed",
        outcomes.size() - failed,
        outcomes.size(),
        failed);
    return outcomes;
  }

  private TranscriptionOutcome runWithContext(Map<String, String> context, Segment segment) {
    if (context != null) {
      MDC.setContextMap(context);
    }
    try {
      return transcribeWithRetry(segment);
    } finally {
      MDC.clear();
    }
  }

  TranscriptionOutcome transcribeWithRetry(Segment segment) {
    long startTime = System.currentTimeMillis();
    TranscriptionOutcome outcome = attemptUntilDone(segment);
    return outcome.withElapsedMs(System.currentTimeMillis() - startTime);
  }

  private TranscriptionOutcome attemptUntilDone(Segment segment) {
    int maxAttempts = retryPolicy.maxAttempts();
    String lastError = null;

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      long attemptStart = System.currentTimeMillis();
      try {
        String text = asrClient.transcribe(segment, prompt);
        structuredLogger.logSegmentTranscribed(
            segment.index(),
            attempt,
            maxAttempts,
            System.currentTimeMillis() - attemptStart,
            text == null ? 0 : text.length());
        return TranscriptionOutcome.ok(segment.index(), text == null ? "" : text, attempt);
      } catch (TranscriptionPermanentException e) {
        structuredLogger.logTranscribeFailed(
            segment.index(), attempt, e.getClass().getSimpleName(), e.getMessage());
        return TranscriptionOutcome.failed(segment.index(), attempt, describe(e));
      } catch (RuntimeException e) {
        lastError = describe(e);
        if (attempt == maxAttempts) {
          break;
        }
        Duration delay = retryPolicy.delayAfterAttempt(attempt);
        structuredLogger.logTranscribeRetry(
            segment.index(),
            attempt,
            maxAttempts,
            e.getClass().getSimpleName(),
            e.getMessage(),
            delay.toMillis());
      }

      if (Thread.currentThread().isInterrupted()) {
        return TranscriptionOutcome.failed(segment.index(), attempt, "interrupted");
      }
      try {
        sleeper.sleep(retryPolicy.delayAfterAttempt(attempt));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return TranscriptionOutcome.failed(segment.index(), attempt, "interrupted during backoff");
      }
    }

    structuredLogger.logTranscribeFailed(
        segment.index(), maxAttempts, "RetriesExhausted", lastError);
    return TranscriptionOutcome.failed(segment.index(), maxAttempts, lastError);
  }

  private TranscriptionOutcome collectAfterInterrupt(
      Future<TranscriptionOutcome> future, Segment segment) {
    if (future.isDone() && !future.isCancelled()) {
      try {
        return future.get();
      } catch (InterruptedException | ExecutionException | CancellationException e) {
        LOGGER.debug("No result for segment {} after interrupt", segment.index(), e);
      }
    } else {
      future.cancel(true);
    }
    return TranscriptionOutcome.failed(segment.index(), 0, "interrupted");
  }

  private static String describe(Throwable error) {
    if (error == null) {
      return "unknown error";
    }
    String message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
  }
}
