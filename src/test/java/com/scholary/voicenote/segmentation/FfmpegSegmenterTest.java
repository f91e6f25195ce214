package com.scholary.voicenote.segmentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.voicenote.PipelineFixtures;
import com.scholary.voicenote.pipeline.Stage;
import com.scholary.voicenote.process.ProcessResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FfmpegSegmenterTest {

  @TempDir Path tempDir;

  private final Path source = Path.of("/recordings/lecture.m4a");

  private FfmpegSegmenter segmenter(FakeProcessRunner runner) {
    return new FfmpegSegmenter(
        runner,
        PipelineFixtures.ffmpegProperties(),
        PipelineFixtures.pipelineProperties(tempDir.resolve("scratch")));
  }

  @Test
  void split_shouldCreateOneFilePerSegment() {
    FakeProcessRunner runner = new FakeProcessRunner();

    List<Segment> segments = segmenter(runner).split(source, 310.0, "run-1");

    assertThat(segments).hasSize(3);
    assertThat(segments).extracting(Segment::index).containsExactly(0, 1, 2);
    assertThat(segments)
        .extracting(Segment::range)
        .containsExactly(
            new TimeRange(0.0, 150.0), new TimeRange(150.0, 300.0), new TimeRange(300.0, 310.0));
    assertThat(segments.get(0).path())
        .isEqualTo(tempDir.resolve("scratch").resolve("run-1").resolve("segment_000.mp3"));
    assertThat(segments).allSatisfy(segment -> assertThat(segment.path()).isRegularFile());
  }

  @Test
  void split_shouldRecordExtractionTimePerSegment() {
    FakeProcessRunner runner = new FakeProcessRunner().withDelay(30);

    List<Segment> segments = segmenter(runner).split(source, 200.0, "run-1");

    assertThat(segments)
        .extracting(Segment::extractionMs)
        .allSatisfy(millis -> assertThat(millis).isGreaterThanOrEqualTo(30L));
  }

  @Test
  void split_shouldReencodeEachSegmentToMonoAt16k() {
    FakeProcessRunner runner = new FakeProcessRunner();

    segmenter(runner).split(source, 310.0, "run-1");

    List<String> second = runner.commands().get(1);
    assertThat(second.get(0)).isEqualTo("ffmpeg");
    assertThat(second)
        .containsSubsequence("-ss", "150.000", "-t", "150.000", "-i", source.toString())
        .containsSubsequence("-vn", "-ac", "1", "-ar", "16000", "-c:a", "libmp3lame", "-y")
        .doesNotContain("copy");
    assertThat(runner.commands().get(2)).containsSubsequence("-ss", "300.000", "-t", "10.000");
  }

  @Test
  void split_shouldReturnNothingForZeroDuration() {
    FakeProcessRunner runner = new FakeProcessRunner();

    assertThat(segmenter(runner).split(source, 0.0, "run-1")).isEmpty();
    assertThat(runner.commands()).isEmpty();
    assertThat(tempDir.resolve("scratch").resolve("run-1")).doesNotExist();
  }

  @Test
  void split_shouldRemovePartialOutputWhenASegmentFails() {
    FakeProcessRunner runner =
        new FakeProcessRunner().failOnCall(1, ProcessResult.completed(1, "Invalid data found"));
    FfmpegSegmenter segmenter = segmenter(runner);

    assertThatThrownBy(() -> segmenter.split(source, 310.0, "run-1"))
        .isInstanceOfSatisfying(
            SegmentationException.class, e -> assertThat(e.stage()).isEqualTo(Stage.SEGMENTATION))
        .hasMessageContaining("segment 1");

    assertThat(runner.commands()).hasSize(2);
    assertThat(segmenter.runDirectory("run-1")).doesNotExist();
  }

  @Test
  void split_shouldFailOnTimeout() {
    FakeProcessRunner runner = new FakeProcessRunner().failOnCall(0, ProcessResult.timeout(""));
    FfmpegSegmenter segmenter = segmenter(runner);

    assertThatThrownBy(() -> segmenter.split(source, 100.0, "run-1"))
        .isInstanceOf(SegmentationException.class)
        .hasMessageContaining("timed out");
    assertThat(segmenter.runDirectory("run-1")).doesNotExist();
  }

  @Test
  void split_shouldFailWhenFfmpegProducesNoFile() {
    FakeProcessRunner runner = new FakeProcessRunner().withoutOutput();
    FfmpegSegmenter segmenter = segmenter(runner);

    assertThatThrownBy(() -> segmenter.split(source, 100.0, "run-1"))
        .isInstanceOf(SegmentationException.class)
        .hasMessageContaining("no output");
  }

  @Test
  void cleanup_shouldDeleteSegmentFilesAndDirectory() throws Exception {
    FfmpegSegmenter segmenter = segmenter(new FakeProcessRunner());
    segmenter.split(source, 310.0, "run-1");

    int removed = segmenter.cleanup("run-1");

    assertThat(removed).isEqualTo(3);
    assertThat(segmenter.runDirectory("run-1")).doesNotExist();
    try (Stream<Path> remaining = Files.list(tempDir.resolve("scratch"))) {
      assertThat(remaining).isEmpty();
    }
  }

  @Test
  void cleanup_shouldIgnoreUnknownRun() {
    assertThat(segmenter(new FakeProcessRunner()).cleanup("never-split")).isZero();
  }

  @Test
  void cleanup_shouldLeaveOtherRunsAlone() {
    FfmpegSegmenter segmenter = segmenter(new FakeProcessRunner());
    segmenter.split(source, 100.0, "run-1");
    segmenter.split(source, 100.0, "run-2");

    segmenter.cleanup("run-1");

    assertThat(segmenter.runDirectory("run-2").resolve("segment_000.mp3")).isRegularFile();
  }
}
