package com.scholary.subtitle.editor.service;

import com.scholary.subtitle.editor.silence.SilenceInterval;
import com.scholary.subtitle.editor.silence.SilenceStats;
import java.util.List;

/**
 * Silence found in a session's media, reported without touching the timeline.
 *
 * @param sessionId the session
 * @param intervals the detected silent intervals
 * @param stats silence statistics
 */
public record SilenceReport(
    String sessionId, List<SilenceInterval> intervals, SilenceStats stats) {

  public SilenceReport {
    intervals = List.copyOf(intervals);
  }
}
