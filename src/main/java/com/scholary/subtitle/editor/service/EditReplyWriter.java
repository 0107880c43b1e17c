package com.scholary.subtitle.editor.service;

import com.scholary.subtitle.editor.edit.EditParameters;
import com.scholary.subtitle.editor.timeline.AppliedResult;
import com.scholary.subtitle.editor.timeline.Mutation;
import com.scholary.subtitle.editor.timeline.Subtitle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Writes the chat reply shown after a request. */
@Component
public class EditReplyWriter {

  static final String HELP_TEXT =
      String.join(
          "\n",
          "I can help you add and style subtitles! Here are some examples:",
          "",
          "- \"Add subtitle 'Hello World' from 0 to 5 seconds\"",
          "- \"Add 'Welcome!' from 1:30 to 1:35 with red color\"",
          "- \"Make the last subtitle bold and yellow\"",
          "- \"Move the first subtitle to 10 seconds\"",
          "",
          "I understand:",
          "- Times: \"5 seconds\", \"1:30\", \"2 minutes 30 seconds\"",
          "- Colors: red, blue, yellow, white, or hex codes like #FF0000",
          "- Fonts: Arial, Helvetica, Roboto, etc.",
          "- Sizes: 12-72 pixels",
          "- Position: top, center, bottom",
          "- Styles: bold, italic");

  static final String READY_TEXT = "I'm ready to help you add subtitles!";

  public String write(String intent, EditParameters parameters, AppliedResult applied) {
    if (applied == null) {
      return "help".equals(intent) ? HELP_TEXT : READY_TEXT;
    }

    Subtitle subtitle = applied.subtitle();
    String timing =
        String.format(
            Locale.ROOT, "from %.1fs to %.1fs", subtitle.startTime(), subtitle.endTime());

    StringBuilder reply = new StringBuilder();
    if (applied.kind() == Mutation.Kind.INSERT) {
      reply.append(String.format("Added subtitle: \"%s\" %s", subtitle.text(), timing));
    } else {
      reply.append(
          String.format(
              Locale.ROOT,
              "Updated subtitle #%d: \"%s\" %s", applied.position() + 1, subtitle.text(), timing));
    }

    List<String> styleParts = new ArrayList<>();
    parameters.fontColor().asOptional().ifPresent(color -> styleParts.add("color: " + color));
    parameters.fontSize().asOptional().ifPresent(size -> styleParts.add("size: " + size + "px"));
    parameters.fontFamily().asOptional().ifPresent(font -> styleParts.add("font: " + font));
    if (!styleParts.isEmpty()) {
      reply.append(" with ").append(String.join(", ", styleParts));
    }
    return reply.toString();
  }
}
