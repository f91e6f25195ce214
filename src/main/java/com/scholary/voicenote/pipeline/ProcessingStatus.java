package com.scholary.voicenote.pipeline;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a recording.
 *
 * <pre>
 * UPLOADED -&gt; PROCESSING -&gt; DONE
 *                        -&gt; FAILED
 * </pre>
 *
 * <p>DONE and FAILED are terminal.
 */
public enum ProcessingStatus {
  UPLOADED,
  PROCESSING,
  DONE,
  FAILED;

  private Set<ProcessingStatus> allowedTargets() {
    switch (this) {
      case UPLOADED:
        return EnumSet.of(PROCESSING);
      case PROCESSING:
        return EnumSet.of(DONE, FAILED);
      default:
        return EnumSet.noneOf(ProcessingStatus.class);
    }
  }

  public boolean canTransitionTo(ProcessingStatus target) {
    return target != null && allowedTargets().contains(target);
  }

  /**
   * Validate a move to another status.
   *
   * @param target the requested status
   * @return {@code target}
   * @throws IllegalStateException if the move is not allowed from this status
   */
  public ProcessingStatus transitionTo(ProcessingStatus target) {
    if (!canTransitionTo(target)) {
      throw new IllegalStateException(
          String.format("Invalid status transition: %s -> %s", this, target));
    }
    return target;
  }

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
