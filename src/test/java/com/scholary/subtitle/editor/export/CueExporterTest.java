package com.scholary.subtitle.editor.export;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.subtitle.editor.timeline.Position;
import com.scholary.subtitle.editor.timeline.Style;
import com.scholary.subtitle.editor.timeline.Subtitle;
import java.util.List;
import org.junit.jupiter.api.Test;

class CueExporterTest {

  private final CueExporter exporter = new CueExporter();

  @Test
  void export_shouldOrderChronologicallyAndNumberFromOne() {
    Style style = new Style("Arial", 32, "white", Position.BOTTOM, null, false, false);
    Subtitle late = new Subtitle("sub_1", "late", 10.0, 12.0, style);
    Subtitle early = new Subtitle("sub_2", "early", 1.0, 2.0, style);
    Subtitle tie = new Subtitle("sub_3", "tie", 1.0, 3.0, style);

    List<ExportCue> cues = exporter.export(List.of(late, early, tie));

    assertThat(cues).extracting(ExportCue::text).containsExactly("early", "tie", "late");
    assertThat(cues).extracting(ExportCue::index).containsExactly(1, 2, 3);
  }

  @Test
  void export_shouldCarryFormattedTimesAndAssStyle() {
    Style style = new Style("Roboto", 40, "yellow", Position.TOP, "black", true, false);
    Subtitle subtitle = new Subtitle("sub_1", "Hello", 65.5, 70.25, style);

    ExportCue cue = exporter.export(List.of(subtitle)).get(0);

    assertThat(cue.start()).isEqualTo(65.5);
    assertThat(cue.end()).isEqualTo(70.25);
    assertThat(cue.srtStart()).isEqualTo("00:01:05,500");
    assertThat(cue.srtEnd()).isEqualTo("00:01:10,250");
    assertThat(cue.assStart()).isEqualTo("0:01:05.50");
    assertThat(cue.assEnd()).isEqualTo("0:01:10.25");
    assertThat(cue.assPrimaryColour()).isEqualTo("&H0000FFFF");
    assertThat(cue.assBackColour()).isEqualTo("&H00000000");
    assertThat(cue.assAlignment()).isEqualTo(8);
    assertThat(cue.style()).isEqualTo(style);
  }

  @Test
  void export_withoutBackgroundShouldLeaveBackColourUnset() {
    Style style = new Style("Arial", 32, "white", Position.BOTTOM, null, false, false);

    ExportCue cue = exporter.export(List.of(new Subtitle("sub_1", "x", 0.0, 1.0, style))).get(0);

    assertThat(cue.assBackColour()).isNull();
    assertThat(cue.assAlignment()).isEqualTo(2);
  }

  @Test
  void export_emptyTimelineShouldYieldNoCues() {
    assertThat(exporter.export(List.of())).isEmpty();
  }
}
