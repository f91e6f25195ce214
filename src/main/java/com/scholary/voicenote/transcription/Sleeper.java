package com.scholary.voicenote.transcription;

import java.time.Duration;

/** Waits between retry attempts. Replaced in tests to avoid real sleeping. */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
