package com.scholary.subtitle.editor.service;

import com.scholary.subtitle.editor.silence.SilenceStats;
import com.scholary.subtitle.editor.silence.TimeRange;
import com.scholary.subtitle.editor.timeline.Subtitle;
import java.util.List;

/**
 * Result of compacting silence out of a session.
 *
 * @param sessionId the session
 * @param silenceRemoved false when no silence was reported and nothing changed
 * @param keepIntervals intervals of the original media to keep, for the trimming step
 * @param stats silence statistics
 * @param subtitles the timeline after compaction
 * @param droppedSubtitles subtitles removed because they no longer had valid timing
 */
public record CompactionOutcome(
    String sessionId,
    boolean silenceRemoved,
    List<TimeRange> keepIntervals,
    SilenceStats stats,
    List<Subtitle> subtitles,
    int droppedSubtitles) {}
