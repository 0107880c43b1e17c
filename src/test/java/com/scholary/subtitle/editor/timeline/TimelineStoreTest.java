package com.scholary.subtitle.editor.timeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimelineStoreTest {

  private static final Style DEFAULT_STYLE =
      new Style("Arial", 32, "white", Position.BOTTOM, null, false, false);

  private TimelineStore store;

  @BeforeEach
  void setUp() {
    AtomicInteger ids = new AtomicInteger();
    store = new TimelineStore(() -> "sub_" + ids.incrementAndGet());
  }

  @Test
  void apply_insertShouldAppendAndAssignId() {
    AppliedResult result = store.apply(insert("Hello", 0.0, 3.0));

    assertThat(result.kind()).isEqualTo(Mutation.Kind.INSERT);
    assertThat(result.position()).isEqualTo(0);
    assertThat(result.timelineSize()).isEqualTo(1);
    assertThat(result.subtitle().id()).isEqualTo("sub_1");
    assertThat(store.snapshot()).containsExactly(result.subtitle());
  }

  @Test
  void apply_insertShouldKeepInsertionOrderRegardlessOfTimes() {
    store.apply(insert("late", 10.0, 12.0));
    store.apply(insert("early", 1.0, 2.0));

    assertThat(store.snapshot()).extracting(Subtitle::text).containsExactly("late", "early");
  }

  @Test
  void apply_insertShouldRejectInvalidTimingAndLeaveTimelineUnchanged() {
    store.apply(insert("kept", 0.0, 1.0));

    assertThatThrownBy(() -> store.apply(insert("bad", 5.0, 5.0)))
        .isInstanceOf(InvalidTimingException.class);
    assertThatThrownBy(() -> store.apply(insert("bad", -1.0, 2.0)))
        .isInstanceOf(InvalidTimingException.class);

    assertThat(store.snapshot()).extracting(Subtitle::text).containsExactly("kept");
  }

  @Test
  void apply_updateWithNegativeAndPositiveIndexShouldTargetSameSubtitle() {
    store.apply(insert("a", 0.0, 1.0));
    store.apply(insert("b", 1.0, 2.0));
    store.apply(insert("c", 2.0, 3.0));

    AppliedResult viaNegative = store.apply(textUpdate(-1, "last"));
    AppliedResult viaPositive = store.apply(textUpdate(2, "third"));

    assertThat(viaNegative.position()).isEqualTo(2);
    assertThat(viaPositive.position()).isEqualTo(2);
    assertThat(viaNegative.subtitle().id()).isEqualTo(viaPositive.subtitle().id());
    assertThat(store.snapshot()).extracting(Subtitle::text).containsExactly("a", "b", "third");
  }

  @Test
  void apply_updateShouldKeepIdAndUnmentionedFields() {
    Subtitle original = store.apply(insert("Hello", 1.0, 4.0)).subtitle();

    StylePatch colorAndBold =
        new StylePatch(
            Optional.empty(),
            Optional.empty(),
            Optional.of("yellow"),
            Optional.empty(),
            Optional.empty(),
            Optional.of(true),
            Optional.empty());
    SubtitlePatch patch =
        new SubtitlePatch(Optional.empty(), Optional.empty(), Optional.of(6.0), colorAndBold);
    Subtitle updated = store.apply(new Mutation.Update(0, patch)).subtitle();

    assertThat(updated.id()).isEqualTo(original.id());
    assertThat(updated.text()).isEqualTo("Hello");
    assertThat(updated.startTime()).isEqualTo(1.0);
    assertThat(updated.endTime()).isEqualTo(6.0);
    assertThat(updated.style().fontColor()).isEqualTo("yellow");
    assertThat(updated.style().bold()).isTrue();
    assertThat(updated.style().fontFamily()).isEqualTo("Arial");
    assertThat(updated.style().fontSize()).isEqualTo(32);
    assertThat(updated.style().position()).isEqualTo(Position.BOTTOM);
  }

  @Test
  void apply_updateOutOfRangeShouldThrowAndLeaveTimelineUnchanged() {
    store.apply(insert("a", 0.0, 1.0));
    store.apply(insert("b", 1.0, 2.0));
    store.apply(insert("c", 2.0, 3.0));
    List<Subtitle> before = store.snapshot();

    assertThatThrownBy(() -> store.apply(textUpdate(5, "nope")))
        .isInstanceOf(SubtitleIndexOutOfRangeException.class);

    assertThat(store.snapshot()).isEqualTo(before);
  }

  @Test
  void apply_updateOnEmptyTimelineShouldThrow() {
    assertThatThrownBy(() -> store.apply(textUpdate(-1, "nope")))
        .isInstanceOf(SubtitleIndexOutOfRangeException.class);
    assertThat(store.size()).isZero();
  }

  @Test
  void apply_updateBreakingTimingShouldThrowAndLeaveTimelineUnchanged() {
    store.apply(insert("a", 5.0, 8.0));
    List<Subtitle> before = store.snapshot();

    SubtitlePatch endBeforeStart =
        new SubtitlePatch(
            Optional.empty(), Optional.empty(), Optional.of(4.0), noStyleChange());

    assertThatThrownBy(() -> store.apply(new Mutation.Update(0, endBeforeStart)))
        .isInstanceOf(InvalidTimingException.class);
    assertThat(store.snapshot()).isEqualTo(before);
  }

  @Test
  void snapshot_shouldBeImmutableCopy() {
    store.apply(insert("a", 0.0, 1.0));
    List<Subtitle> snapshot = store.snapshot();

    store.apply(insert("b", 1.0, 2.0));

    assertThat(snapshot).hasSize(1);
    assertThatThrownBy(() -> snapshot.add(snapshot.get(0)))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void chronological_shouldSortByStartAndKeepInsertionOrderForTies() {
    store.apply(insert("third", 4.0, 5.0));
    store.apply(insert("first", 1.0, 2.0));
    store.apply(insert("second", 1.0, 3.0));

    assertThat(store.chronological())
        .extracting(Subtitle::text)
        .containsExactly("first", "second", "third");
    assertThat(store.snapshot())
        .extracting(Subtitle::text)
        .containsExactly("third", "first", "second");
  }

  @Test
  void replace_withOwnSnapshotShouldBeNoOp() {
    store.apply(insert("a", 0.0, 1.0));
    store.apply(insert("b", 1.0, 2.0));
    List<Subtitle> before = store.snapshot();

    int dropped = store.replace(store.snapshot());

    assertThat(dropped).isZero();
    assertThat(store.snapshot()).isEqualTo(before);
  }

  @Test
  void replace_shouldDropSubtitlesWithInvalidTiming() {
    Subtitle valid = new Subtitle("sub_x", "ok", 1.0, 2.0, DEFAULT_STYLE);
    Subtitle collapsed = new Subtitle("sub_y", "gone", 2.0, 2.0, DEFAULT_STYLE);
    Subtitle negative = new Subtitle("sub_z", "gone", -1.0, 2.0, DEFAULT_STYLE);

    int dropped = store.replace(List.of(collapsed, valid, negative));

    assertThat(dropped).isEqualTo(2);
    assertThat(store.snapshot()).containsExactly(valid);
  }

  @Test
  void clear_shouldRemoveEverythingAndReportCount() {
    store.apply(insert("a", 0.0, 1.0));
    store.apply(insert("b", 1.0, 2.0));

    assertThat(store.clear()).isEqualTo(2);
    assertThat(store.size()).isZero();
  }

  @Test
  void defaultIdGenerator_shouldProducePrefixedIds() {
    TimelineStore withDefaultIds = new TimelineStore();

    String id = withDefaultIds.apply(insert("a", 0.0, 1.0)).subtitle().id();

    assertThat(id).matches("sub_[0-9a-f]{12}");
  }

  private static Mutation insert(String text, double start, double end) {
    return new Mutation.Insert(new SubtitleDraft(text, start, end, DEFAULT_STYLE));
  }

  private static Mutation textUpdate(int index, String text) {
    return new Mutation.Update(
        index,
        new SubtitlePatch(
            Optional.of(text), Optional.empty(), Optional.empty(), noStyleChange()));
  }

  private static StylePatch noStyleChange() {
    return new StylePatch(
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty());
  }
}
