package com.scholary.voicenote.transcription;

import java.time.Duration;

/**
 * Attempt limit and exponential backoff for ASR calls.
 *
 * <p>After failed attempt {@code n} (1-based) the worker waits {@code baseDelay * 2^(n-1)}, capped
 * at {@code maxDelay}: with the defaults that is 1s, then 2s, then 4s and so on up to 30s.
 *
 * @param maxAttempts total attempts per segment, including the first one
 * @param baseDelay delay after the first failed attempt
 * @param maxDelay upper bound for a single delay
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("At least one attempt is required");
    }
    if (baseDelay == null || baseDelay.isNegative()) {
      throw new IllegalArgumentException("Base delay must not be negative");
    }
    if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException("Max delay must be >= base delay");
    }
  }

  /**
   * Delay to wait after a failed attempt.
   *
   * @param failedAttempt the 1-based number of the attempt that just failed
   * @return the backoff delay, never more than {@link #maxDelay()}
   */
  public Duration delayAfterAttempt(int failedAttempt) {
    if (failedAttempt < 1) {
      throw new IllegalArgumentException("Attempts are numbered from 1");
    }
    int exponent = Math.min(failedAttempt - 1, 62);
    long baseMillis = baseDelay.toMillis();
    // shifting past maxDelay >> exponent would exceed the cap or overflow
    if (baseMillis > maxDelay.toMillis() >> exponent) {
      return maxDelay;
    }
    return Duration.ofMillis(baseMillis << exponent);
  }
}
