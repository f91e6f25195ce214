package com.scholary.voicenote.segmentation;

import com.scholary.voicenote.config.PipelineProperties;
import com.scholary.voicenote.process.ProcessResult;
import com.scholary.voicenote.process.ProcessRunner;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cuts a recording into fixed-length segments using ffmpeg.
 *
 * <p>Boundaries come from {@link SegmentPlanner}. Each segment is extracted on its own and
 * re-encoded (never stream-copied) to the configured mono sample format, so every segment file is a
 * valid standalone input for the ASR service regardless of the source container or codec.
 *
 * <p>Segment files of a run live in their own directory under the scratch root:
 *
 * <pre>
 * {scratchDir}/{runId}/segment_000.mp3
 * {scratchDir}/{runId}/segment_001.mp3
 * </pre>
 */
@Component
public class FfmpegSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegSegmenter.class);

  private final ProcessRunner processRunner;
  private final FfmpegProperties ffmpegProperties;
  private final Path scratchRoot;
  private final int segmentSeconds;

  public FfmpegSegmenter(
      ProcessRunner processRunner,
      FfmpegProperties ffmpegProperties,
      PipelineProperties pipelineProperties) {
    this.processRunner = processRunner;
    this.ffmpegProperties = ffmpegProperties;
    this.scratchRoot = Paths.get(pipelineProperties.scratchDir());
    this.segmentSeconds = pipelineProperties.segmentSeconds();
  }

  /**
   * Split a recording into re-encoded segment files.
   *
   * @param source the recording to split
   * @param totalSeconds the probed duration of the recording
   * @param runId identifies the run; used as the name of the segment directory
   * @return segments in index order; empty if the duration is not positive
   * @throws SegmentationException if any segment could not be extracted; no segment files of this
   *     run remain on disk when it is thrown
   */
  public List<Segment> split(Path source, double totalSeconds, String runId) {
    List<TimeRange> ranges = SegmentPlanner.plan(totalSeconds, segmentSeconds);
    if (ranges.isEmpty()) {
      LOGGER.warn("Nothing to split: duration={}s, source={}", totalSeconds, source);
      return List.of();
    }

    LOGGER.info(
        "Splitting {}s audio into {} segments of <={}s each",
        totalSeconds,
        ranges.size(),
        segmentSeconds);

    Path runDirectory = runDirectory(runId);
    try {
      Files.createDirectories(runDirectory);
    } catch (IOException e) {
      throw new SegmentationException("Failed to create segment directory: " + runDirectory, e);
    }

    long splitStart = System.currentTimeMillis();
    List<Segment> segments = new ArrayList<>(ranges.size());
    try {
      for (int i = 0; i < ranges.size(); i++) {
        TimeRange range = ranges.get(i);
        Path output =
            runDirectory.resolve(
                String.format(
                    Locale.ROOT, "segment_%03d.%s", i, ffmpegProperties.segmentExtension()));

        long segmentStart = System.currentTimeMillis();
        extract(source, range, output, i);
        long extractionMs = System.currentTimeMillis() - segmentStart;
        segments.add(new Segment(i, range, output, extractionMs));

        LOGGER.info(
            "Created segment {}/{}: {}s-{}s ({}ms to extract)",
            i + 1,
            ranges.size(),
            range.start(),
            range.end(),
            extractionMs);
      }
    } catch (SegmentationException e) {
      LOGGER.error(
          "Segmentation aborted after {}/{} segments, removing partial output: {}",
          segments.size(),
          ranges.size(),
          e.getMessage());
      cleanup(runId);
      throw e;
    }

    LOGGER.info(
        "Audio splitting completed in {}ms for {} segments",
        System.currentTimeMillis() - splitStart,
        segments.size());
    return List.copyOf(segments);
  }

  /**
   * Delete every segment file of a run together with its directory.
   *
   * <p>Never throws: files that cannot be removed are logged and skipped.
   *
   * @param runId the run whose segments should be removed
   * @return the number of files deleted
   */
  public int cleanup(String runId) {
    Path runDirectory = runDirectory(runId);
    if (!Files.exists(runDirectory)) {
      return 0;
    }

    List<Path> paths;
    try (Stream<Path> walk = Files.walk(runDirectory)) {
      paths = walk.sorted(Comparator.reverseOrder()).toList();
    } catch (IOException | UncheckedIOException e) {
      LOGGER.warn("Could not list segment directory {}", runDirectory, e);
      return 0;
    }

    int deletedFiles = 0;
    for (Path path : paths) {
      try {
        boolean directory = Files.isDirectory(path);
        if (Files.deleteIfExists(path) && !directory) {
          deletedFiles++;
        }
      } catch (IOException e) {
        LOGGER.warn("Could not remove {}", path, e);
      }
    }
    LOGGER.debug("Removed {} segment files from {}", deletedFiles, runDirectory);
    return deletedFiles;
  }

  /** Directory holding the segment files of one run. */
  public Path runDirectory(String runId) {
    return scratchRoot.resolve(runId);
  }

  private void extract(Path source, TimeRange range, Path output, int index) {
    // -ss before -i seeks on the input; with re-encoding the cut is sample accurate
    List<String> command =
        List.of(
            ffmpegProperties.ffmpegPath(),
            "-hide_banner",
            "-loglevel", "error",
            "-ss", formatSeconds(range.start()),
            "-t", formatSeconds(range.duration()),
            "-i", source.toString(),
            "-vn",
            "-ac", String.valueOf(ffmpegProperties.channels()),
            "-ar", String.valueOf(ffmpegProperties.sampleRate()),
            "-c:a", ffmpegProperties.codec(),
            "-y",
            output.toString());

    ProcessResult result;
    try {
      result = processRunner.run(command, ffmpegProperties.segmentTimeout());
    } catch (IOException e) {
      throw new SegmentationException("Could not run ffmpeg for segment " + index, e);
    }

    if (result.timedOut()) {
      throw new SegmentationException(
          String.format(
              "ffmpeg timed out after %ds for segment %d",
              ffmpegProperties.segmentTimeout().toSeconds(), index));
    }
    if (result.exitCode() != 0) {
      throw new SegmentationException(
          String.format(
              "ffmpeg failed with exit code %d for segment %d: %s",
              result.exitCode(), index, result.output()));
    }
    if (!isNonEmptyFile(output)) {
      throw new SegmentationException(
          "ffmpeg reported success but produced no output for segment " + index);
    }
  }

  private static boolean isNonEmptyFile(Path path) {
    try {
      return Files.isRegularFile(path) && Files.size(path) > 0;
    } catch (IOException e) {
      return false;
    }
  }

  private static String formatSeconds(double seconds) {
    return String.format(Locale.ROOT, "%.3f", seconds);
  }
}
