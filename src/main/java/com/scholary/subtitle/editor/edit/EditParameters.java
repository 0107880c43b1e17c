package com.scholary.subtitle.editor.edit;

import java.util.Objects;

/**
 * The closed set of parameters the NLU oracle may extract from a user message.
 *
 * <p>Times are kept as the raw text the oracle produced; the compiler runs them through the time
 * parser so that "1:30" and "90 seconds" are treated alike.
 */
public record EditParameters(
    ParamField<String> text,
    ParamField<String> startTime,
    ParamField<String> endTime,
    ParamField<String> fontFamily,
    ParamField<Integer> fontSize,
    ParamField<String> fontColor,
    ParamField<String> position,
    ParamField<String> backgroundColor,
    ParamField<Boolean> bold,
    ParamField<Boolean> italic,
    ParamField<Integer> subtitleIndex) {

  public EditParameters {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(startTime, "startTime");
    Objects.requireNonNull(endTime, "endTime");
    Objects.requireNonNull(fontFamily, "fontFamily");
    Objects.requireNonNull(fontSize, "fontSize");
    Objects.requireNonNull(fontColor, "fontColor");
    Objects.requireNonNull(position, "position");
    Objects.requireNonNull(backgroundColor, "backgroundColor");
    Objects.requireNonNull(bold, "bold");
    Objects.requireNonNull(italic, "italic");
    Objects.requireNonNull(subtitleIndex, "subtitleIndex");
  }

  /** A bag in which every parameter is absent. */
  public static EditParameters empty() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder defaulting every field to absent. */
  public static final class Builder {

    private ParamField<String> text = ParamField.absent();
    private ParamField<String> startTime = ParamField.absent();
    private ParamField<String> endTime = ParamField.absent();
    private ParamField<String> fontFamily = ParamField.absent();
    private ParamField<Integer> fontSize = ParamField.absent();
    private ParamField<String> fontColor = ParamField.absent();
    private ParamField<String> position = ParamField.absent();
    private ParamField<String> backgroundColor = ParamField.absent();
    private ParamField<Boolean> bold = ParamField.absent();
    private ParamField<Boolean> italic = ParamField.absent();
    private ParamField<Integer> subtitleIndex = ParamField.absent();

    private Builder() {}

    public Builder text(ParamField<String> text) {
      this.text = text;
      return this;
    }

    public Builder text(String text) {
      return text(ParamField.ofNullable(text));
    }

    public Builder startTime(ParamField<String> startTime) {
      this.startTime = startTime;
      return this;
    }

    public Builder startTime(String startTime) {
      return startTime(ParamField.ofNullable(startTime));
    }

    public Builder endTime(ParamField<String> endTime) {
      this.endTime = endTime;
      return this;
    }

    public Builder endTime(String endTime) {
      return endTime(ParamField.ofNullable(endTime));
    }

    public Builder fontFamily(ParamField<String> fontFamily) {
      this.fontFamily = fontFamily;
      return this;
    }

    public Builder fontFamily(String fontFamily) {
      return fontFamily(ParamField.ofNullable(fontFamily));
    }

    public Builder fontSize(ParamField<Integer> fontSize) {
      this.fontSize = fontSize;
      return this;
    }

    public Builder fontSize(Integer fontSize) {
      return fontSize(ParamField.ofNullable(fontSize));
    }

    public Builder fontColor(ParamField<String> fontColor) {
      this.fontColor = fontColor;
      return this;
    }

    public Builder fontColor(String fontColor) {
      return fontColor(ParamField.ofNullable(fontColor));
    }

    public Builder position(ParamField<String> position) {
      this.position = position;
      return this;
    }

    public Builder position(String position) {
      return position(ParamField.ofNullable(position));
    }

    public Builder backgroundColor(ParamField<String> backgroundColor) {
      this.backgroundColor = backgroundColor;
      return this;
    }

    public Builder backgroundColor(String backgroundColor) {
      return backgroundColor(ParamField.ofNullable(backgroundColor));
    }

    public Builder bold(ParamField<Boolean> bold) {
      this.bold = bold;
      return this;
    }

    public Builder bold(Boolean bold) {
      return bold(ParamField.ofNullable(bold));
    }

    public Builder italic(ParamField<Boolean> italic) {
      this.italic = italic;
      return this;
    }

    public Builder italic(Boolean italic) {
      return italic(ParamField.ofNullable(italic));
    }

    public Builder subtitleIndex(ParamField<Integer> subtitleIndex) {
      this.subtitleIndex = subtitleIndex;
      return this;
    }

    public Builder subtitleIndex(Integer subtitleIndex) {
      return subtitleIndex(ParamField.ofNullable(subtitleIndex));
    }

    public EditParameters build() {
      return new EditParameters(
          text,
          startTime,
          endTime,
          fontFamily,
          fontSize,
          fontColor,
          position,
          backgroundColor,
          bold,
          italic,
          subtitleIndex);
    }
  }
}
