package com.scholary.voicenote.process;

/**
 * Outcome of one external process invocation.
 *
 * @param exitCode the exit code, or -1 when the process was killed after a timeout
 * @param output combined stdout and stderr, trimmed
 * @param timedOut whether the process was killed because it exceeded its timeout
 */
public record ProcessResult(int exitCode, String output, boolean timedOut) {

  public static ProcessResult completed(int exitCode, String output) {
    return new ProcessResult(exitCode, output, false);
  }

  public static ProcessResult timeout(String output) {
    return new ProcessResult(-1, output, true);
  }

  public boolean succeeded() {
    return !timedOut && exitCode == 0;
  }
}
