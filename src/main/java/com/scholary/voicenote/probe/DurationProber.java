package com.scholary.voicenote.probe;

import java.nio.file.Path;

/** Read-only introspection of audio files. */
public interface DurationProber {

  /**
   * Determine the exact duration of an audio file.
   *
   * @param audioFile the file to inspect
   * @return the duration in seconds, always finite and greater than zero
   * @throws ProbeException if the tool is unavailable, the file is unreadable, or the reported
   *     duration is zero
   */
  double probe(Path audioFile);

  /**
   * Check that the media tooling needed by a run is installed and working.
   *
   * @throws ProbeException if any required tool is missing
   */
  void verifyToolsAvailable();
}
