package com.scholary.subtitle.editor.silence;

import java.util.List;

/**
 * Result of silence detection on one media file.
 *
 * @param intervals silent intervals, sorted and non-overlapping
 * @param totalDuration duration of the whole media in seconds
 */
public record SilenceDetection(List<SilenceInterval> intervals, double totalDuration) {

  public SilenceDetection {
    intervals = List.copyOf(intervals);
    if (totalDuration < 0) {
      throw new IllegalArgumentException("Total duration cannot be negative");
    }
  }

  public boolean hasSilence() {
    return !intervals.isEmpty();
  }
}
