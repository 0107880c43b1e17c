package com.scholary.subtitle.editor.timeline;

import java.util.Locale;

/** Thrown when a change would leave a subtitle with a negative start or end at/before start. */
public class InvalidTimingException extends TimelineMutationException {

  public InvalidTimingException(double startTime, double endTime) {
    super(
        String.format(
            Locale.ROOT,
            "Invalid subtitle timing: start=%.2fs, end=%.2fs (end must be after start, start"
                + " must not be negative)",
            startTime, endTime));
  }
}
