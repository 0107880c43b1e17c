package com.scholary.subtitle.editor.edit;

import com.scholary.subtitle.editor.timeline.Mutation;
import com.scholary.subtitle.editor.timeline.Position;
import com.scholary.subtitle.editor.timeline.Style;
import com.scholary.subtitle.editor.timeline.StylePatch;
import com.scholary.subtitle.editor.timeline.Subtitle;
import com.scholary.subtitle.editor.timeline.SubtitleDraft;
import com.scholary.subtitle.editor.timeline.SubtitlePatch;
import com.scholary.subtitle.editor.timeparse.TimeParseException;
import com.scholary.subtitle.editor.timeparse.TimeReferenceParser;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compiles an oracle intent and its extracted parameters into one timeline mutation.
 *
 * <p>Two paths:
 *
 * <ul>
 *   <li><b>Addition</b> ({@code add_subtitle}, or {@code modify_style} without a subtitle index):
 *       every field gets a value. Missing times default to {@code 0.0} and {@code start + 3.0},
 *       missing style fields come from the configured default style.
 *   <li><b>Modification</b> ({@code modify_subtitle}, or {@code modify_style} with an index):
 *       only the fields the user mentioned are carried; everything else stays as it is. The index
 *       defaults to {@code -1}, the most recently added subtitle.
 * </ul>
 *
 * <p>Any other intent compiles to no mutation at all. The compiler never bounds-checks the index;
 * that happens when the mutation is applied to the timeline it was compiled against.
 */
@Component
public class EditCompiler {

  private static final Logger LOGGER = LoggerFactory.getLogger(EditCompiler.class);

  static final double DEFAULT_START_SECONDS = 0.0;
  static final double DEFAULT_DURATION_SECONDS = 3.0;
  static final int DEFAULT_SUBTITLE_INDEX = -1;

  private final TimeReferenceParser timeParser;
  private final SubtitleDefaultsProperties defaults;

  public EditCompiler(TimeReferenceParser timeParser, SubtitleDefaultsProperties defaults) {
    this.timeParser = timeParser;
    this.defaults = defaults;
  }

  /**
   * Compile one request.
   *
   * @param intent the oracle's intent label
   * @param params the extracted parameters
   * @param timeline the timeline as the compiler sees it, in insertion order
   * @return the mutation, or empty for intents that do not edit the timeline
   * @throws EditCompileException if a supplied value cannot be used
   */
  public Optional<Mutation> compile(String intent, EditParameters params, List<Subtitle> timeline) {
    Optional<EditIntent> editIntent = EditIntent.fromLabel(intent);
    if (editIntent.isEmpty()) {
      LOGGER.debug("Intent '{}' does not edit the timeline", intent);
      return Optional.empty();
    }

    EditParameters effective = params == null ? EditParameters.empty() : params;
    Mutation mutation =
        switch (editIntent.get()) {
          case ADD_SUBTITLE -> compileInsert(effective);
          case MODIFY_SUBTITLE -> compileUpdate(effective);
          case MODIFY_STYLE ->
              effective.subtitleIndex().isPresent()
                  ? compileUpdate(effective)
                  : compileInsert(effective);
        };

    LOGGER.debug(
        "Compiled intent '{}' into {} against a timeline of {}",
        intent,
        mutation.kind(),
        timeline.size());
    return Optional.of(mutation);
  }

  private Mutation compileInsert(EditParameters params) {
    double start =
        timeParser.parseOrDefault(params.startTime().orElse(null), DEFAULT_START_SECONDS);
    double end = timeParser.parseOrDefault(params.endTime().orElse(null), -1);
    if (end <= start) {
      end = start + DEFAULT_DURATION_SECONDS;
    }
    if (end <= start) {
      // start + 3.0 rounds back to start for very large values
      throw new EditCompileException(
          String.format(Locale.ROOT, "Start time %.2fs is too large to place a subtitle", start));
    }

    Style base = defaults.toStyle();
    Style style =
        new Style(
            nonBlank(params.fontFamily()).orElse(base.fontFamily()),
            validFontSize(params).orElse(base.fontSize()),
            nonBlank(params.fontColor()).orElse(base.fontColor()),
            validPosition(params).orElse(base.position()),
            nonBlank(params.backgroundColor()).orElse(base.backgroundColor()),
            params.bold().orElse(base.bold()),
            params.italic().orElse(base.italic()));

    String text = params.text().orElse("");
    return new Mutation.Insert(new SubtitleDraft(text, start, end, style));
  }

  private Mutation compileUpdate(EditParameters params) {
    int index = params.subtitleIndex().orElse(DEFAULT_SUBTITLE_INDEX);

    StylePatch stylePatch =
        new StylePatch(
            nonBlank(params.fontFamily()),
            validFontSize(params),
            nonBlank(params.fontColor()),
            validPosition(params),
            nonBlank(params.backgroundColor()),
            params.bold().asOptional(),
            params.italic().asOptional());

    SubtitlePatch patch =
        new SubtitlePatch(
            params.text().asOptional(),
            parsePresentTime("start_time", params.startTime()),
            parsePresentTime("end_time", params.endTime()),
            stylePatch);
    return new Mutation.Update(index, patch);
  }

  private Optional<Double> parsePresentTime(String name, ParamField<String> field) {
    Optional<String> raw = nonBlank(field);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(timeParser.parse(raw.get()));
    } catch (TimeParseException e) {
      throw new EditCompileException(
          String.format("Could not understand %s '%s'", name, e.getExpression()), e);
    }
  }

  // Blank text in a style or time field counts as not mentioned.
  private Optional<String> nonBlank(ParamField<String> field) {
    return field.asOptional().map(String::trim).filter(value -> !value.isEmpty());
  }

  private Optional<Integer> validFontSize(EditParameters params) {
    Optional<Integer> fontSize = params.fontSize().asOptional();
    if (fontSize.isPresent() && !Style.isValidFontSize(fontSize.get())) {
      throw new EditCompileException(
          String.format(
              Locale.ROOT,
              "Font size must be between %d and %d, got %d",
              Style.MIN_FONT_SIZE, Style.MAX_FONT_SIZE, fontSize.get()));
    }
    return fontSize;
  }

  private Optional<Position> validPosition(EditParameters params) {
    Optional<String> position = params.position().asOptional();
    if (position.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        Position.fromName(position.get())
            .orElseThrow(
                () ->
                    new EditCompileException(
                        "Position must be top, center or bottom, got: " + position.get())));
  }
}
