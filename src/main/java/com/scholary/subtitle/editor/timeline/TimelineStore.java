package com.scholary.subtitle.editor.timeline;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The subtitle timeline of one editing session.
 *
 * <p>Subtitles are kept in insertion order. Chronological order is only a derived view ({@link
 * #chronological()}); the store never re-sorts its own sequence.
 *
 * <p>Every mutating method is all-or-nothing: it either commits the whole change or throws and
 * leaves the sequence untouched. Methods synchronize on the store, so at most one mutation per
 * session is in flight; separate sessions use separate stores and never contend. A caller that
 * needs to read and then replace the timeline as one step synchronizes on the store itself.
 */
public class TimelineStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimelineStore.class);

  private final List<Subtitle> subtitles = new ArrayList<>();
  private final Supplier<String> idGenerator;

  public TimelineStore() {
    this(TimelineStore::newSubtitleId);
  }

  public TimelineStore(Supplier<String> idGenerator) {
    this.idGenerator = idGenerator;
  }

  /**
   * Apply one mutation.
   *
   * @param mutation an insert or an update
   * @return what was committed
   * @throws SubtitleIndexOutOfRangeException if an update names no existing subtitle
   * @throws InvalidTimingException if the resulting subtitle would break the timing invariant
   */
  public synchronized AppliedResult apply(Mutation mutation) {
    if (mutation instanceof Mutation.Insert insert) {
      return applyInsert(insert);
    }
    if (mutation instanceof Mutation.Update update) {
      return applyUpdate(update);
    }
    throw new IllegalArgumentException("Unsupported mutation: " + mutation);
  }

  private AppliedResult applyInsert(Mutation.Insert insert) {
    Subtitle subtitle = insert.draft().toSubtitle(idGenerator.get());
    if (!subtitle.hasValidTiming()) {
      throw new InvalidTimingException(subtitle.startTime(), subtitle.endTime());
    }

    subtitles.add(subtitle);
    LOGGER.debug(
        "Inserted subtitle {} at [{}-{}]", subtitle.id(), subtitle.startTime(), subtitle.endTime());
    return new AppliedResult(
        Mutation.Kind.INSERT, subtitle, subtitles.size() - 1, subtitles.size());
  }

  private AppliedResult applyUpdate(Mutation.Update update) {
    int position = OrdinalIndex.resolve(update.index(), subtitles.size());
    Subtitle existing = subtitles.get(position);

    Subtitle updated = update.patch().applyTo(existing);
    if (!updated.hasValidTiming()) {
      throw new InvalidTimingException(updated.startTime(), updated.endTime());
    }

    subtitles.set(position, updated);
    LOGGER.debug("Updated subtitle {} at position {}", updated.id(), position);
    return new AppliedResult(Mutation.Kind.UPDATE, updated, position, subtitles.size());
  }

  /** Immutable copy of the timeline in insertion order. */
  public synchronized List<Subtitle> snapshot() {
    return List.copyOf(subtitles);
  }

  /** Immutable copy sorted by start time; equal starts keep their insertion order. */
  public synchronized List<Subtitle> chronological() {
    return subtitles.stream().sorted(Comparator.comparingDouble(Subtitle::startTime)).toList();
  }

  /**
   * Replace the whole timeline.
   *
   * <p>Elements that break the timing invariant are dropped rather than failing the replacement.
   *
   * @param replacement the new sequence, in the order it should be kept
   * @return the number of elements dropped
   */
  public synchronized int replace(List<Subtitle> replacement) {
    List<Subtitle> accepted = replacement.stream().filter(Subtitle::hasValidTiming).toList();
    int dropped = replacement.size() - accepted.size();

    subtitles.clear();
    subtitles.addAll(accepted);

    if (dropped > 0) {
      LOGGER.debug("Dropped {} subtitles with invalid timing during replace", dropped);
    }
    return dropped;
  }

  /**
   * Remove every subtitle.
   *
   * @return how many subtitles were removed
   */
  public synchronized int clear() {
    int removed = subtitles.size();
    subtitles.clear();
    return removed;
  }

  public synchronized int size() {
    return subtitles.size();
  }

  private static String newSubtitleId() {
    return "sub_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
  }
}
