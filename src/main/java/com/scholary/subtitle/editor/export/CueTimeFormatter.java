package com.scholary.subtitle.editor.export;

import java.util.Locale;

/**
 * Timecode formatting for subtitle file writers.
 *
 * <p>Values are rounded to the format's precision rather than truncated, so 5.29s stays 5.29s
 * despite its binary representation.
 */
public final class CueTimeFormatter {

  private CueTimeFormatter() {}

  /**
   * Format a time in seconds as SRT timecode.
   *
   * <p>Format: HH:MM:SS,mmm (hours:minutes:seconds,milliseconds)
   */
  public static String srt(double seconds) {
    long totalMillis = Math.round(Math.max(0, seconds) * 1000);
    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis % 3_600_000) / 60_000;
    long secs = (totalMillis % 60_000) / 1000;
    long millis = totalMillis % 1000;

    return String.format(Locale.ROOT, "%02d:%02d:%02d,%03d", hours, minutes, secs, millis);
  }

  /**
   * Format a time in seconds as ASS timecode.
   *
   * <p>Format: H:MM:SS.cc (hours unpadded, centiseconds)
   */
  public static String ass(double seconds) {
    long totalCentis = Math.round(Math.max(0, seconds) * 100);
    long hours = totalCentis / 360_000;
    long minutes = (totalCentis % 360_000) / 6000;
    long secs = (totalCentis % 6000) / 100;
    long centis = totalCentis % 100;

    return String.format(Locale.ROOT, "%d:%02d:%02d.%02d", hours, minutes, secs, centis);
  }
}
