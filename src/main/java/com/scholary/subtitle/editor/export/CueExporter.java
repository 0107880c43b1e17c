package com.scholary.subtitle.editor.export;

import com.scholary.subtitle.editor.timeline.Style;
import com.scholary.subtitle.editor.timeline.Subtitle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Prepares a timeline for the external SRT/ASS writer and the encoder.
 *
 * <p>Cues come out in chronological order (stable for equal start times) and are numbered from 1,
 * as SRT expects. Writing the actual file is left to the caller.
 */
@Component
public class CueExporter {

  public List<ExportCue> export(List<Subtitle> timeline) {
    List<Subtitle> ordered =
        timeline.stream().sorted(Comparator.comparingDouble(Subtitle::startTime)).toList();

    List<ExportCue> cues = new ArrayList<>(ordered.size());
    for (int i = 0; i < ordered.size(); i++) {
      cues.add(toCue(i + 1, ordered.get(i)));
    }
    return cues;
  }

  private ExportCue toCue(int index, Subtitle subtitle) {
    Style style = subtitle.style();
    String backColour =
        style.backgroundColor() == null ? null : AssStyleMapper.toAssColor(style.backgroundColor());

    return new ExportCue(
        index,
        subtitle.startTime(),
        subtitle.endTime(),
        subtitle.text(),
        style,
        CueTimeFormatter.srt(subtitle.startTime()),
        CueTimeFormatter.srt(subtitle.endTime()),
        CueTimeFormatter.ass(subtitle.startTime()),
        CueTimeFormatter.ass(subtitle.endTime()),
        AssStyleMapper.toAssColor(style.fontColor()),
        backColour,
        AssStyleMapper.alignment(style.position()));
  }
}
