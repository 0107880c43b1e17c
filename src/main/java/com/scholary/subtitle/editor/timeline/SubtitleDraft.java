package com.scholary.subtitle.editor.timeline;

import java.util.Objects;

/** Fully populated subtitle fields for an insertion; the store assigns the id. */
public record SubtitleDraft(String text, double startTime, double endTime, Style style) {

  public SubtitleDraft {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(style, "style");
  }

  Subtitle toSubtitle(String id) {
    return new Subtitle(id, text, startTime, endTime, style);
  }
}
