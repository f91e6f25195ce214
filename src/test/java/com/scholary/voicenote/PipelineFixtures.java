package com.scholary.voicenote;

import com.scholary.voicenote.config.PipelineProperties;
import com.scholary.voicenote.segmentation.FfmpegProperties;
import java.nio.file.Path;
import java.time.Duration;

/** Property objects with the production defaults, for tests that build components by hand. */
public final class PipelineFixtures {

  public static final String PROMPT =
      "متن این فایل صوتی مربوط به یک جلسهٔ آموزشی به زبان فارسی است.";

  private PipelineFixtures() {}

  public static PipelineProperties pipelineProperties(Path scratchDir) {
    return pipelineProperties(scratchDir, 3, 3, false);
  }

  public static PipelineProperties pipelineProperties(
      Path scratchDir, int maxConcurrency, int maxAttempts, boolean failWhenAllSegmentsFailed) {
    return new PipelineProperties(
        150,
        maxConcurrency,
        maxAttempts,
        Duration.ofSeconds(1),
        Duration.ofSeconds(30),
        scratchDir.toString(),
        failWhenAllSegmentsFailed,
        PROMPT);
  }

  public static FfmpegProperties ffmpegProperties() {
    return new FfmpegProperties(
        "ffmpeg",
        "ffprobe",
        16000,
        1,
        "libmp3lame",
        "mp3",
        Duration.ofSeconds(10),
        Duration.ofSeconds(60));
  }
}
