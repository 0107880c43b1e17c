package com.scholary.subtitle.editor.timeline;

import java.util.Locale;

/** Thrown when an ordinal subtitle reference does not name an existing subtitle. */
public class SubtitleIndexOutOfRangeException extends TimelineMutationException {

  private final int index;
  private final int length;

  public SubtitleIndexOutOfRangeException(int index, int length) {
    super(
        String.format(
            Locale.ROOT,
            "No such subtitle: index %d is out of range for a timeline of %d", index, length));
    this.index = index;
    this.length = length;
  }

  public int getIndex() {
    return index;
  }

  public int getLength() {
    return length;
  }
}
