package com.scholary.subtitle.editor.silence;

import com.scholary.subtitle.editor.timeline.Subtitle;
import java.util.List;

/**
 * Output of {@link SilenceCompactor#compact}.
 *
 * @param keepIntervals the intervals of the original media that survive, ascending
 * @param subtitles remapped subtitles, in their original order, invalid ones removed
 * @param droppedSubtitles how many subtitles did not survive remapping
 */
public record CompactionResult(
    List<TimeRange> keepIntervals, List<Subtitle> subtitles, int droppedSubtitles) {

  public CompactionResult {
    keepIntervals = List.copyOf(keepIntervals);
    subtitles = List.copyOf(subtitles);
  }

  public double keptDuration() {
    return keepIntervals.stream().mapToDouble(TimeRange::duration).sum();
  }
}
