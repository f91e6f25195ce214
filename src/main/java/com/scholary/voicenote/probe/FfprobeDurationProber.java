package com.scholary.voicenote.probe;

import com.scholary.voicenote.process.ProcessResult;
import com.scholary.voicenote.process.ProcessRunner;
import com.scholary.voicenote.segmentation.FfmpegProperties;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Gets audio durations from ffprobe.
 *
 * <p>ffprobe is asked for the container duration only, printed as a bare number:
 *
 * <pre>
 * ffprobe -v error -show_entries format=duration -of default=noprint_wrappers=1:nokey=1 input.m4a
 * 310.054000
 * </pre>
 */
@Component
public class FfprobeDurationProber implements DurationProber {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfprobeDurationProber.class);

  private final ProcessRunner processRunner;
  private final FfmpegProperties properties;

  public FfprobeDurationProber(ProcessRunner processRunner, FfmpegProperties properties) {
    this.processRunner = processRunner;
    this.properties = properties;
  }

  @Override
  public double probe(Path audioFile) {
    List<String> command =
        List.of(
            properties.ffprobePath(),
            "-v", "error",
            "-show_entries", "format=duration",
            "-of", "default=noprint_wrappers=1:nokey=1",
            audioFile.toString());

    long startTime = System.currentTimeMillis();
    ProcessResult result;
    try {
      result = processRunner.run(command, properties.probeTimeout());
    } catch (IOException e) {
      throw new ProbeException("Could not run ffprobe on " + audioFile + ": " + e.getMessage(), e);
    }

    if (result.timedOut()) {
      throw new ProbeException(
          String.format(
              "ffprobe timed out after %ds on %s",
              properties.probeTimeout().toSeconds(), audioFile));
    }
    if (result.exitCode() != 0) {
      throw new ProbeException(
          String.format(
              "ffprobe failed with exit code %d on %s: %s",
              result.exitCode(), audioFile, result.output()));
    }

    double duration = parseDuration(result.output(), audioFile);
    LOGGER.info(
        "ffprobe duration check completed in {}ms: {}s total duration",
        System.currentTimeMillis() - startTime,
        duration);
    return duration;
  }

  @Override
  public void verifyToolsAvailable() {
    for (String tool : List.of(properties.ffmpegPath(), properties.ffprobePath())) {
      ProcessResult result;
      try {
        result = processRunner.run(List.of(tool, "-version"), properties.probeTimeout());
      } catch (IOException e) {
        throw new ProbeException(tool + " not found or not executable: " + e.getMessage(), e);
      }
      if (!result.succeeded()) {
        throw new ProbeException(tool + " is not working properly: " + result.output());
      }
      LOGGER.debug("{} is available: {}", tool, result.output().lines().findFirst().orElse(""));
    }
  }

  private double parseDuration(String output, Path audioFile) {
    double duration;
    try {
      duration = Double.parseDouble(output.trim());
    } catch (NumberFormatException e) {
      throw new ProbeException(
          "Failed to parse duration from ffprobe output for " + audioFile + ": " + output, e);
    }
    if (!Double.isFinite(duration) || duration <= 0) {
      throw new ProbeException("Invalid probed duration for " + audioFile + ": " + output);
    }
    return duration;
  }
}
