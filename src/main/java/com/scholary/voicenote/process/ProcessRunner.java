package com.scholary.voicenote.process;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command-line tool and waits for it to finish.
 *
 * <p>The duration prober and the segmenter go through this seam instead of calling {@link
 * ProcessBuilder} directly, so tests can substitute a fake that never spawns ffmpeg.
 */
public interface ProcessRunner {

  /**
   * Run a command to completion, or until the timeout elapses.
   *
   * @param command the executable followed by its arguments
   * @param timeout upper bound on the wall-clock run time; the process is killed when it elapses
   * @return exit code and combined stdout/stderr of the process
   * @throws IOException if the process could not be started or waiting was interrupted
   */
  ProcessResult run(List<String> command, Duration timeout) throws IOException;
}
