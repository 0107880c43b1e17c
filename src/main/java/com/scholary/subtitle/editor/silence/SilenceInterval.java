package com.scholary.subtitle.editor.silence;

/**
 * A detected silent stretch of the source media, in seconds.
 *
 * <p>Lists of intervals handed to the compactor are expected to be sorted by start and
 * non-overlapping; the detector guarantees that, the compactor does not re-check it.
 */
public record SilenceInterval(double start, double end) {

  public double duration() {
    return end - start;
  }

  /**
   * Whether this interval has fully ended by time {@code t}.
   *
   * <p>Only intervals that have ended count as removed time before {@code t}; one that merely
   * contains {@code t} does not.
   */
  public boolean endsBy(double t) {
    return end <= t;
  }
}
