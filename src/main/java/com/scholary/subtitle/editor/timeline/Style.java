package com.scholary.subtitle.editor.timeline;

import java.util.Locale;

/**
 * Visual style of one subtitle.
 *
 * <p>Immutable; a subtitle owns exactly one style by value. Updates rebuild the style field by
 * field through {@link StylePatch}.
 */
public record Style(
    String fontFamily,
    int fontSize,
    String fontColor,
    Position position,
    String backgroundColor,
    boolean bold,
    boolean italic) {

  public static final int MIN_FONT_SIZE = 12;
  public static final int MAX_FONT_SIZE = 72;

  public Style {
    if (fontFamily == null || fontFamily.isBlank()) {
      throw new IllegalArgumentException("Font family cannot be blank");
    }
    if (fontSize < MIN_FONT_SIZE || fontSize > MAX_FONT_SIZE) {
      throw new IllegalArgumentException(
          String.format(
              Locale.ROOT,
              "Font size must be between %d and %d, got %d",
              MIN_FONT_SIZE, MAX_FONT_SIZE, fontSize));
    }
    if (fontColor == null || fontColor.isBlank()) {
      throw new IllegalArgumentException("Font color cannot be blank");
    }
    if (position == null) {
      throw new IllegalArgumentException("Position cannot be null");
    }
  }

  public static boolean isValidFontSize(int fontSize) {
    return fontSize >= MIN_FONT_SIZE && fontSize <= MAX_FONT_SIZE;
  }
}
