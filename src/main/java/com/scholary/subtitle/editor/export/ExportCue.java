package com.scholary.subtitle.editor.export;

import com.scholary.subtitle.editor.timeline.Style;

/**
 * One subtitle prepared for a file writer or an encoder's subtitle filter.
 *
 * @param index 1-based position in chronological order
 * @param start start in seconds
 * @param end end in seconds
 * @param text subtitle text
 * @param style the subtitle's style
 * @param srtStart start as {@code HH:MM:SS,mmm}
 * @param srtEnd end as {@code HH:MM:SS,mmm}
 * @param assStart start as {@code H:MM:SS.cc}
 * @param assEnd end as {@code H:MM:SS.cc}
 * @param assPrimaryColour font colour as {@code &H00BBGGRR}
 * @param assBackColour background colour as {@code &H00BBGGRR}, or null if none
 * @param assAlignment 2, 5 or 8 for bottom, center or top
 */
public record ExportCue(
    int index,
    double start,
    double end,
    String text,
    Style style,
    String srtStart,
    String srtEnd,
    String assStart,
    String assEnd,
    String assPrimaryColour,
    String assBackColour,
    int assAlignment) {}
