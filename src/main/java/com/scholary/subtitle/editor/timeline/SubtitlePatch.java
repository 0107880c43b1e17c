package com.scholary.subtitle.editor.timeline;

import java.util.Objects;
import java.util.Optional;

/** Partial subtitle update carried by {@link Mutation.Update}. Empty means unchanged. */
public record SubtitlePatch(
    Optional<String> text,
    Optional<Double> startTime,
    Optional<Double> endTime,
    StylePatch style) {

  public SubtitlePatch {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(startTime, "startTime");
    Objects.requireNonNull(endTime, "endTime");
    Objects.requireNonNull(style, "style");
  }

  /** Overlay the present fields onto {@code existing}, keeping its id. */
  public Subtitle applyTo(Subtitle existing) {
    return new Subtitle(
        existing.id(),
        text.orElse(existing.text()),
        startTime.orElse(existing.startTime()),
        endTime.orElse(existing.endTime()),
        style.applyTo(existing.style()));
  }
}
