package com.scholary.subtitle.editor.nlu;

import com.scholary.subtitle.editor.timeline.Subtitle;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Describes a timeline in plain text for the oracle's prompt.
 *
 * <p>Lines are listed by insertion position, since that is what ordinal references such as
 * "the second subtitle" or "the last one" resolve against.
 */
@Component
public class TimelineContextDescriber {

  static final String EMPTY_TIMELINE = "The timeline has no subtitles yet.";

  public String describe(List<Subtitle> timeline) {
    if (timeline.isEmpty()) {
      return EMPTY_TIMELINE;
    }

    StringBuilder description =
        new StringBuilder(
            String.format(Locale.ROOT, "The timeline has %d subtitles:%n", timeline.size()));
    for (int i = 0; i < timeline.size(); i++) {
      Subtitle subtitle = timeline.get(i);
      description.append(
          String.format(
              Locale.ROOT,
              "%d. [%.2fs-%.2fs] \"%s\" (%s, %dpx, %s, %s)%n",
              i,
              subtitle.startTime(),
              subtitle.endTime(),
              subtitle.text(),
              subtitle.style().fontFamily(),
              subtitle.style().fontSize(),
              subtitle.style().fontColor(),
              subtitle.style().position().name().toLowerCase(Locale.ROOT)));
    }
    return description.toString();
  }
}
