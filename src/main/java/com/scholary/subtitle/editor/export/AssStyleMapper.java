package com.scholary.subtitle.editor.export;

import com.scholary.subtitle.editor.timeline.Position;
import java.util.Locale;
import java.util.Map;

/** Maps subtitle style values onto ASS style fields. */
public final class AssStyleMapper {

  private static final String WHITE = "#FFFFFF";

  private static final Map<String, String> COLOR_NAMES =
      Map.ofEntries(
          Map.entry("white", "#FFFFFF"),
          Map.entry("black", "#000000"),
          Map.entry("red", "#FF0000"),
          Map.entry("green", "#00FF00"),
          Map.entry("blue", "#0000FF"),
          Map.entry("yellow", "#FFFF00"),
          Map.entry("cyan", "#00FFFF"),
          Map.entry("magenta", "#FF00FF"),
          Map.entry("orange", "#FFA500"),
          Map.entry("purple", "#800080"),
          Map.entry("pink", "#FFC0CB"),
          Map.entry("brown", "#A52A2A"),
          Map.entry("gray", "#808080"),
          Map.entry("grey", "#808080"));

  private AssStyleMapper() {}

  /**
   * Resolve a colour name or hex string to {@code #RRGGBB}.
   *
   * <p>Unknown names and malformed hex fall back to white.
   */
  public static String toHex(String color) {
    if (color == null) {
      return WHITE;
    }
    String normalized = color.trim().toLowerCase(Locale.ROOT);
    if (normalized.startsWith("#")) {
      return normalized.matches("#[0-9a-f]{6}") ? normalized.toUpperCase(Locale.ROOT) : WHITE;
    }
    return COLOR_NAMES.getOrDefault(normalized, WHITE);
  }

  /**
   * Convert a colour to ASS {@code &H00BBGGRR} (alpha always 00, i.e. opaque).
   *
   * @param color colour name or {@code #RRGGBB}
   * @return the ASS colour string
   */
  public static String toAssColor(String color) {
    String hex = toHex(color);
    int r = Integer.parseInt(hex.substring(1, 3), 16);
    int g = Integer.parseInt(hex.substring(3, 5), 16);
    int b = Integer.parseInt(hex.substring(5, 7), 16);
    return String.format(Locale.ROOT, "&H00%02X%02X%02X", b, g, r);
  }

  /** ASS numpad alignment: 2 bottom-center, 5 middle-center, 8 top-center. */
  public static int alignment(Position position) {
    return switch (position) {
      case TOP -> 8;
      case CENTER -> 5;
      case BOTTOM -> 2;
    };
  }
}
