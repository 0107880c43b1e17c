package com.scholary.subtitle.editor.timeline;

import java.util.Objects;

/**
 * One subtitle entry on the timeline.
 *
 * <p>Times are in seconds. The record itself does not enforce the timing invariant, so that
 * callers such as the silence compactor can build a candidate and filter it; {@link
 * TimelineStore} refuses to commit any subtitle for which {@link #hasValidTiming()} is false.
 */
public record Subtitle(String id, String text, double startTime, double endTime, Style style) {

  public Subtitle {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(style, "style");
  }

  /** True when {@code startTime >= 0} and {@code endTime > startTime}. */
  public boolean hasValidTiming() {
    return startTime >= 0 && endTime > startTime;
  }

  public Subtitle withTimes(double newStart, double newEnd) {
    return new Subtitle(id, text, newStart, newEnd, style);
  }
}
