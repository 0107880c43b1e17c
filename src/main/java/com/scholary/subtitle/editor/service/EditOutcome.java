package com.scholary.subtitle.editor.service;

import com.scholary.subtitle.editor.edit.EditParameters;
import com.scholary.subtitle.editor.timeline.AppliedResult;
import com.scholary.subtitle.editor.timeline.Subtitle;
import java.util.List;

/**
 * Result of processing one chat message.
 *
 * @param sessionId the session
 * @param intent the normalized intent label
 * @param parameters what the oracle extracted
 * @param applied the committed change, or null if the intent does not edit the timeline
 * @param reply a short confirmation for the user
 * @param subtitles the timeline after the request, in insertion order
 */
public record EditOutcome(
    String sessionId,
    String intent,
    EditParameters parameters,
    AppliedResult applied,
    String reply,
    List<Subtitle> subtitles) {

  public boolean timelineChanged() {
    return applied != null;
  }
}
