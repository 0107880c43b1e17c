package com.scholary.subtitle.editor.silence;

import com.scholary.subtitle.editor.timeline.Subtitle;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compacts silent intervals out of a subtitle timeline.
 *
 * <p>Two things come out of a compaction:
 *
 * <ol>
 *   <li>The keep intervals: the complement of the silence list within {@code [0, duration)}. The
 *       media trimming step cuts and concatenates exactly these.
 *   <li>The subtitles moved onto the shortened time axis.
 * </ol>
 *
 * <p>Remapping subtracts only silence that has fully ended before a timestamp. A timestamp that
 * falls inside a silent interval is shifted by the earlier intervals only.
 */
@Component
public class SilenceCompactor {

  private static final Logger LOGGER = LoggerFactory.getLogger(SilenceCompactor.class);

  /**
   * Compact a timeline.
   *
   * @param silence sorted, non-overlapping silent intervals
   * @param totalDuration duration of the original media in seconds
   * @param timeline the subtitles to remap, in insertion order
   * @return keep intervals and remapped subtitles
   */
  public CompactionResult compact(
      List<SilenceInterval> silence, double totalDuration, List<Subtitle> timeline) {
    List<TimeRange> keep = keepIntervals(silence, totalDuration);

    List<Subtitle> remapped = new ArrayList<>(timeline.size());
    for (Subtitle subtitle : timeline) {
      double newStart = remap(silence, subtitle.startTime());
      double newEnd = remap(silence, subtitle.endTime());

      if (newStart >= 0 && newEnd > newStart) {
        remapped.add(subtitle.withTimes(newStart, newEnd));
      } else {
        LOGGER.debug(
            "Dropping subtitle {}: [{}-{}] remaps to [{}-{}]",
            subtitle.id(),
            subtitle.startTime(),
            subtitle.endTime(),
            newStart,
            newEnd);
      }
    }

    CompactionResult result =
        new CompactionResult(keep, remapped, timeline.size() - remapped.size());
    LOGGER.info(
        "Compacted {} silent intervals: {} keep intervals ({}s), {} subtitles kept, {} dropped",
        silence.size(),
        keep.size(),
        round2(result.keptDuration()),
        remapped.size(),
        result.droppedSubtitles());
    return result;
  }

  /**
   * Complement of the silence list within {@code [0, totalDuration)}.
   *
   * <p>With no silence the result is the single interval {@code [0, totalDuration)}.
   *
   * @param silence sorted, non-overlapping silent intervals
   * @param totalDuration duration of the original media in seconds
   * @return ascending, non-overlapping keep intervals
   */
  public List<TimeRange> keepIntervals(List<SilenceInterval> silence, double totalDuration) {
    List<TimeRange> keep = new ArrayList<>();
    double cursor = 0.0;

    for (SilenceInterval interval : silence) {
      if (interval.start() > cursor) {
        keep.add(new TimeRange(cursor, interval.start()));
      }
      cursor = interval.end();
    }

    if (cursor < totalDuration) {
      keep.add(new TimeRange(cursor, totalDuration));
    }
    return keep;
  }

  /** Move {@code t} onto the compacted time axis, rounded to 2 decimals. */
  public double remap(List<SilenceInterval> silence, double t) {
    return round2(t - removedBefore(silence, t));
  }

  /**
   * Total silence that has completely ended by time {@code t}.
   *
   * @param silence the silent intervals
   * @param t a timestamp on the original time axis
   * @return seconds of silence removed before {@code t}
   */
  public double removedBefore(List<SilenceInterval> silence, double t) {
    double removed = 0.0;
    for (SilenceInterval interval : silence) {
      if (interval.endsBy(t)) {
        removed += interval.duration();
      }
    }
    return removed;
  }

  /**
   * Summarize a silence list against the media duration.
   *
   * @param silence the silent intervals
   * @param totalDuration duration of the original media in seconds
   * @return rounded statistics; the percentage is 0 for a zero duration
   */
  public SilenceStats stats(List<SilenceInterval> silence, double totalDuration) {
    double totalSilence = silence.stream().mapToDouble(SilenceInterval::duration).sum();
    double percentage = totalDuration > 0 ? totalSilence / totalDuration * 100 : 0;

    return new SilenceStats(
        round2(totalSilence),
        round2(percentage),
        silence.size(),
        round2(totalDuration),
        round2(totalDuration - totalSilence));
  }

  // Half-even on the exact binary value, so 2.675 rounds to 2.67.
  static double round2(double value) {
    return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
  }
}
