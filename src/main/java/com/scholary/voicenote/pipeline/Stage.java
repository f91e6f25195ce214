package com.scholary.voicenote.pipeline;

/** Stages of a processing run, in execution order. Used to label failures in logs and reports. */
public enum Stage {
  PROBE,
  SEGMENTATION,
  TRANSCRIPTION,
  MERGE,
  PERSISTENCE
}
