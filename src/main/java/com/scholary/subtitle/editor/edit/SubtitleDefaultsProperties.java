package com.scholary.subtitle.editor.edit;

import com.scholary.subtitle.editor.timeline.Position;
import com.scholary.subtitle.editor.timeline.Style;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Default style applied to new subtitles for every field the user did not mention.
 *
 * <p>Bound from {@code subtitle.defaults.*} in application.yml.
 */
@ConfigurationProperties(prefix = "subtitle.defaults")
@Validated
public record SubtitleDefaultsProperties(
    @NotBlank String fontFamily,
    @Min(12) @Max(72) int fontSize,
    @NotBlank String fontColor,
    @NotNull Position position) {

  public Style toStyle() {
    return new Style(fontFamily, fontSize, fontColor, position, null, false, false);
  }
}
