package com.scholary.subtitle.editor.edit;

import java.util.Optional;

/** Intents that produce a timeline mutation. Every other intent label is informational. */
public enum EditIntent {
  ADD_SUBTITLE("add_subtitle"),
  MODIFY_SUBTITLE("modify_subtitle"),
  MODIFY_STYLE("modify_style");

  private final String label;

  EditIntent(String label) {
    this.label = label;
  }

  /** Exact, case-sensitive match on the oracle's intent label. */
  public static Optional<EditIntent> fromLabel(String label) {
    for (EditIntent intent : values()) {
      if (intent.label.equals(label)) {
        return Optional.of(intent);
      }
    }
    return Optional.empty();
  }
}
