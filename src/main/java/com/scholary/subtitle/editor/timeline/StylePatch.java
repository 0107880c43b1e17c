package com.scholary.subtitle.editor.timeline;

import java.util.Optional;

/**
 * Partial style update. An empty field leaves the existing value untouched.
 *
 * <p>{@code backgroundColor} can only be set, not cleared.
 */
public record StylePatch(
    Optional<String> fontFamily,
    Optional<Integer> fontSize,
    Optional<String> fontColor,
    Optional<Position> position,
    Optional<String> backgroundColor,
    Optional<Boolean> bold,
    Optional<Boolean> italic) {

  /**
   * Build a new style from {@code base} with every present field of this patch applied.
   *
   * @throws IllegalArgumentException if the result is not a valid style
   */
  public Style applyTo(Style base) {
    return new Style(
        fontFamily.orElse(base.fontFamily()),
        fontSize.orElse(base.fontSize()),
        fontColor.orElse(base.fontColor()),
        position.orElse(base.position()),
        backgroundColor.orElse(base.backgroundColor()),
        bold.orElse(base.bold()),
        italic.orElse(base.italic()));
  }
}
