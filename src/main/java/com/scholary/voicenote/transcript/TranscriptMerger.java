package com.scholary.voicenote.transcript;

import com.scholary.voicenote.transcription.TranscriptionOutcome;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reassembles per-segment outcomes into one document.
 *
 * <p>Segments never overlap, so merging is plain concatenation in index order: each successful
 * segment contributes its normalized text, each failed one the {@link #SENTINEL}. Chunks are
 * separated by a blank line.
 *
 * <p>Normalization only touches whitespace:
 *
 * <ul>
 *   <li>every line is trimmed and runs of spaces or tabs become one space
 *   <li>runs of blank lines become a single blank line
 *   <li>blank lines at the start and end of a chunk are dropped
 * </ul>
 *
 * <p>Merging always succeeds. An all-failed list gives an all-sentinel document and an empty list
 * gives empty text.
 */
@Component
public class TranscriptMerger {

  public static final String SENTINEL = "[SEGMENT FAILED]";

  static final String CHUNK_SEPARATOR = "\n\n";

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptMerger.class);

  private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");
  private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t]+");

  /**
   * Merge outcomes into a single document.
   *
   * @param outcomes one outcome per segment, in any order
   * @return the merged transcript
   * @throws IllegalArgumentException if two outcomes share a segment index
   */
  public MergedTranscript merge(List<TranscriptionOutcome> outcomes) {
    List<TranscriptionOutcome> ordered = new ArrayList<>(outcomes);
    ordered.sort(Comparator.comparingInt(TranscriptionOutcome::segmentIndex));

    Set<Integer> seen = new HashSet<>();
    List<String> chunks = new ArrayList<>(ordered.size());
    int failed = 0;

    for (TranscriptionOutcome outcome : ordered) {
      if (!seen.add(outcome.segmentIndex())) {
        throw new IllegalArgumentException(
            "Duplicate outcome for segment " + outcome.segmentIndex());
      }
      if (outcome.isFailed()) {
        chunks.add(SENTINEL);
        failed++;
        continue;
      }
      String normalized = normalize(outcome.text());
      if (normalized.isEmpty()) {
        LOGGER.debug("Segment {} produced no text", outcome.segmentIndex());
        continue;
      }
      chunks.add(normalized);
    }

    String text = String.join(CHUNK_SEPARATOR, chunks);
    LOGGER.info(
        "Merged {} segments ({} failed) into {} characters", ordered.size(), failed, text.length());
    return new MergedTranscript(text, ordered.size(), failed);
  }

  /**
   * Normalize the whitespace of one chunk of text. Words are left untouched.
   *
   * @param text raw text, may be {@code null}
   * @return the normalized text, empty if there is nothing but whitespace
   */
  static String normalize(String text) {
    if (text == null) {
      return "";
    }
    StringBuilder result = new StringBuilder(text.length());
    boolean pendingBlank = false;
    for (String rawLine : LINE_BREAK.split(text, -1)) {
      String line = HORIZONTAL_WHITESPACE.matcher(rawLine.strip()).replaceAll(" ");
      if (line.isEmpty()) {
        pendingBlank = result.length() > 0;
        continue;
      }
      if (result.length() > 0) {
        result.append(pendingBlank ? "\n\n" : "\n");
      }
      result.append(line);
      pendingBlank = false;
    }
    return result.toString();
  }
}
