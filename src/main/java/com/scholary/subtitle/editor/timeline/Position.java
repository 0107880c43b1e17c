package com.scholary.subtitle.editor.timeline;

import java.util.Locale;
import java.util.Optional;

/** Vertical placement of a subtitle on the video frame. */
public enum Position {
  TOP,
  CENTER,
  BOTTOM;

  /**
   * Look up a position by name, ignoring case and surrounding whitespace.
   *
   * @param value the name, e.g. "top" or "Bottom"
   * @return the position, or empty if the name is unknown
   */
  public static Optional<Position> fromName(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (Position position : values()) {
      if (position.name().equals(normalized)) {
        return Optional.of(position);
      }
    }
    return Optional.empty();
  }
}
