package com.scholary.subtitle.editor.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.subtitle.editor.edit.EditParameters;
import com.scholary.subtitle.editor.timeline.AppliedResult;
import com.scholary.subtitle.editor.timeline.Mutation;
import com.scholary.subtitle.editor.timeline.Position;
import com.scholary.subtitle.editor.timeline.Style;
import com.scholary.subtitle.editor.timeline.Subtitle;
import org.junit.jupiter.api.Test;

class EditReplyWriterTest {

  private static final Subtitle SUBTITLE =
      new Subtitle(
          "sub_1",
          "Hello",
          1.5,
          4.0,
          new Style("Arial", 32, "white", Position.BOTTOM, null, false, false));

  private final EditReplyWriter writer = new EditReplyWriter();

  @Test
  void write_insertShouldConfirmTextAndTiming() {
    AppliedResult applied = new AppliedResult(Mutation.Kind.INSERT, SUBTITLE, 0, 1);

    String reply = writer.write("add_subtitle", EditParameters.empty(), applied);

    assertThat(reply).isEqualTo("Added subtitle: \"Hello\" from 1.5s to 4.0s");
  }

  @Test
  void write_updateShouldUseOneBasedPosition() {
    AppliedResult applied = new AppliedResult(Mutation.Kind.UPDATE, SUBTITLE, 2, 3);
    EditParameters params = EditParameters.builder().fontFamily("Roboto").build();

    String reply = writer.write("modify_subtitle", params, applied);

    assertThat(reply)
        .isEqualTo("Updated subtitle #3: \"Hello\" from 1.5s to 4.0s with font: Roboto");
  }

  @Test
  void write_withoutMutationShouldReplyHelpOrReady() {
    assertThat(writer.write("help", EditParameters.empty(), null))
        .isEqualTo(EditReplyWriter.HELP_TEXT);
    assertThat(writer.write("chitchat", EditParameters.empty(), null))
        .isEqualTo(EditReplyWriter.READY_TEXT);
  }
}
