package com.scholary.subtitle.editor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.subtitle.editor.session.CaffeineSessionStore;
import com.scholary.subtitle.editor.session.EditSession;
import com.scholary.subtitle.editor.session.SessionNotFoundException;
import com.scholary.subtitle.editor.session.SessionProperties;
import com.scholary.subtitle.editor.silence.SilenceCompactor;
import com.scholary.subtitle.editor.silence.SilenceDetection;
import com.scholary.subtitle.editor.silence.SilenceDetector;
import com.scholary.subtitle.editor.silence.SilenceInterval;
import com.scholary.subtitle.editor.silence.TimeRange;
import com.scholary.subtitle.editor.timeline.Mutation;
import com.scholary.subtitle.editor.timeline.Position;
import com.scholary.subtitle.editor.timeline.Style;
import com.scholary.subtitle.editor.timeline.Subtitle;
import com.scholary.subtitle.editor.timeline.SubtitleDraft;
import com.scholary.subtitle.editor.timeline.TimelineStore;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SilenceCompactionServiceTest {

  private static final Style STYLE =
      new Style("Arial", 32, "white", Position.BOTTOM, null, false, false);
  private static final Path MEDIA = Path.of("video.mp4");

  @Mock private SilenceDetector silenceDetector;

  private CaffeineSessionStore sessionStore;
  private SilenceCompactionService service;
  private TimelineStore timeline;

  @BeforeEach
  void setUp() {
    sessionStore = new CaffeineSessionStore(new SessionProperties(100, 60));
    service = new SilenceCompactionService(sessionStore, silenceDetector, new SilenceCompactor());

    timeline = new TimelineStore();
    sessionStore.put("sess_1", new EditSession(timeline));
  }

  @Test
  void detectAndCompact_shouldRemapTimelineAndReturnKeepIntervals() {
    add("before", 0.5, 1.5);
    add("after", 5.0, 8.0);
    add("swallowed", 3.0, 4.0);
    when(silenceDetector.detect(MEDIA))
        .thenReturn(
            new SilenceDetection(
                List.of(new SilenceInterval(2.0, 4.0), new SilenceInterval(6.0, 7.0)), 10.0));

    CompactionOutcome outcome = service.detectAndCompact("sess_1", MEDIA);

    assertThat(outcome.silenceRemoved()).isTrue();
    assertThat(outcome.keepIntervals())
        .containsExactly(
            new TimeRange(0.0, 2.0), new TimeRange(4.0, 6.0), new TimeRange(7.0, 10.0));
    assertThat(outcome.droppedSubtitles()).isEqualTo(1);
    assertThat(outcome.stats().totalSilenceDuration()).isEqualTo(3.0);
    assertThat(outcome.stats().durationAfterRemoval()).isEqualTo(7.0);

    assertThat(timeline.snapshot())
        .extracting(Subtitle::text, Subtitle::startTime, Subtitle::endTime)
        .containsExactly(tuple("before", 0.5, 1.5), tuple("after", 3.0, 5.0));
    assertThat(outcome.subtitles()).isEqualTo(timeline.snapshot());
  }

  @Test
  void compact_withoutSilenceShouldLeaveTimelineUnchanged() {
    add("a", 1.0, 2.0);
    List<Subtitle> before = timeline.snapshot();

    CompactionOutcome outcome = service.compact("sess_1", new SilenceDetection(List.of(), 30.0));

    assertThat(outcome.silenceRemoved()).isFalse();
    assertThat(outcome.keepIntervals()).containsExactly(new TimeRange(0.0, 30.0));
    assertThat(outcome.stats().silentSegments()).isZero();
    assertThat(outcome.droppedSubtitles()).isZero();
    assertThat(timeline.snapshot()).isEqualTo(before);
  }

  @Test
  void compact_shouldKeepSubtitleIdsAndStyles() {
    Subtitle original = add("a", 5.0, 6.0);

    service.compact("sess_1", new SilenceDetection(List.of(new SilenceInterval(1.0, 2.0)), 10.0));

    Subtitle remapped = timeline.snapshot().get(0);
    assertThat(remapped.id()).isEqualTo(original.id());
    assertThat(remapped.style()).isEqualTo(original.style());
    assertThat(remapped.startTime()).isEqualTo(4.0);
  }

  @Test
  void detectAndCompact_unknownSessionShouldThrowWithoutDetecting() {
    assertThatThrownBy(() -> service.detectAndCompact("sess_unknown", MEDIA))
        .isInstanceOf(SessionNotFoundException.class);
    verify(silenceDetector, never()).detect(any());
  }

  @Test
  void detect_shouldReportSilenceWithoutChangingTimeline() {
    add("after", 5.0, 8.0);
    List<Subtitle> before = timeline.snapshot();
    when(silenceDetector.detect(MEDIA))
        .thenReturn(
            new SilenceDetection(
                List.of(new SilenceInterval(2.0, 4.0), new SilenceInterval(6.0, 7.0)), 10.0));

    SilenceReport report = service.detect("sess_1", MEDIA);

    assertThat(report.sessionId()).isEqualTo("sess_1");
    assertThat(report.intervals())
        .containsExactly(new SilenceInterval(2.0, 4.0), new SilenceInterval(6.0, 7.0));
    assertThat(report.stats().silentSegments()).isEqualTo(2);
    assertThat(report.stats().silencePercentage()).isEqualTo(30.0);
    assertThat(timeline.snapshot()).isEqualTo(before);
  }

  @Test
  void detect_unknownSessionShouldThrowWithoutDetecting() {
    assertThatThrownBy(() -> service.detect("sess_unknown", MEDIA))
        .isInstanceOf(SessionNotFoundException.class);
    verify(silenceDetector, never()).detect(any());
  }

  private Subtitle add(String text, double start, double end) {
    SubtitleDraft draft = new SubtitleDraft(text, start, end, STYLE);
    return timeline.apply(new Mutation.Insert(draft)).subtitle();
  }
}
