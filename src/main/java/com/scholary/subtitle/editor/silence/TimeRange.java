package com.scholary.subtitle.editor.silence;

/**
 * A time range in seconds, {@code [start, end)}.
 *
 * <p>Used for the keep intervals a compaction hands to the media trimming step.
 */
public record TimeRange(double start, double end) {

  public TimeRange {
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end < start) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  public double duration() {
    return end - start;
  }
}
