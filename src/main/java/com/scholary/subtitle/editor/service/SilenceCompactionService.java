package com.scholary.subtitle.editor.service;

import com.scholary.subtitle.editor.logging.StructuredLogger;
import com.scholary.subtitle.editor.session.EditSession;
import com.scholary.subtitle.editor.session.SessionNotFoundException;
import com.scholary.subtitle.editor.session.SessionStore;
import com.scholary.subtitle.editor.silence.CompactionResult;
import com.scholary.subtitle.editor.silence.SilenceCompactor;
import com.scholary.subtitle.editor.silence.SilenceDetection;
import com.scholary.subtitle.editor.silence.SilenceDetector;
import com.scholary.subtitle.editor.silence.SilenceStats;
import com.scholary.subtitle.editor.silence.TimeRange;
import com.scholary.subtitle.editor.timeline.TimelineStore;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reports silence in a session's media and compacts it out of the timeline.
 *
 * <p>The snapshot, the remap and the replacement happen while holding the timeline's lock, so an
 * edit cannot slip in between and be lost by the replacement.
 */
@Service
public class SilenceCompactionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SilenceCompactionService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final SessionStore sessionStore;
  private final SilenceDetector silenceDetector;
  private final SilenceCompactor compactor;

  public SilenceCompactionService(
      SessionStore sessionStore, SilenceDetector silenceDetector, SilenceCompactor compactor) {
    this.sessionStore = sessionStore;
    this.silenceDetector = silenceDetector;
    this.compactor = compactor;
  }

  /**
   * Detect silence in a session's media and report it, leaving the timeline unchanged.
   *
   * @param sessionId the session whose media is analyzed
   * @param mediaFile the media to analyze
   * @return the detected intervals and their statistics
   * @throws SessionNotFoundException if the session does not exist
   */
  public SilenceReport detect(String sessionId, Path mediaFile) {
    requireTimeline(sessionId);
    LOGGER.info("Detecting silence for session {}: {}", sessionId, mediaFile.getFileName());
    SilenceDetection detection = silenceDetector.detect(mediaFile);
    SilenceStats stats = compactor.stats(detection.intervals(), detection.totalDuration());
    LOGGER.info(
        "Found {} silent intervals ({}s, {}%)",
        stats.silentSegments(),
        stats.totalSilenceDuration(),
        stats.silencePercentage());
    return new SilenceReport(sessionId, detection.intervals(), stats);
  }

  /**
   * Detect silence in a media file and compact it out of a session.
   *
   * @param sessionId the session whose subtitles belong to the media
   * @param mediaFile the media to analyze
   * @return the compaction outcome
   * @throws SessionNotFoundException if the session does not exist
   */
  public CompactionOutcome detectAndCompact(String sessionId, Path mediaFile) {
    TimelineStore timeline = requireTimeline(sessionId);
    LOGGER.info("Detecting silence for session {}: {}", sessionId, mediaFile.getFileName());
    SilenceDetection detection = silenceDetector.detect(mediaFile);
    return compact(sessionId, timeline, detection);
  }

  /**
   * Compact already-detected silence out of a session.
   *
   * @param sessionId the session
   * @param detection silence intervals and media duration
   * @return the compaction outcome
   * @throws SessionNotFoundException if the session does not exist
   */
  public CompactionOutcome compact(String sessionId, SilenceDetection detection) {
    return compact(sessionId, requireTimeline(sessionId), detection);
  }

  private CompactionOutcome compact(
      String sessionId, TimelineStore timeline, SilenceDetection detection) {
    StructuredLogger.setSessionContext(sessionId);
    try {
      SilenceStats stats = compactor.stats(detection.intervals(), detection.totalDuration());

      if (!detection.hasSilence()) {
        LOGGER.info("No silence detected, leaving timeline unchanged");
        List<TimeRange> keep =
            compactor.keepIntervals(detection.intervals(), detection.totalDuration());
        return new CompactionOutcome(sessionId, false, keep, stats, timeline.snapshot(), 0);
      }

      CompactionResult result;
      int droppedOnReplace;
      synchronized (timeline) {
        result =
            compactor.compact(
                detection.intervals(), detection.totalDuration(), timeline.snapshot());
        droppedOnReplace = timeline.replace(result.subtitles());
      }

      int dropped = result.droppedSubtitles() + droppedOnReplace;
      STRUCTURED_LOGGER.logTimelineCompacted(
          stats.silentSegments(),
          stats.totalSilenceDuration(),
          result.keepIntervals().size(),
          result.subtitles().size() - droppedOnReplace,
          dropped);

      return new CompactionOutcome(
          sessionId, true, result.keepIntervals(), stats, timeline.snapshot(), dropped);
    } finally {
      StructuredLogger.clearSessionContext();
    }
  }

  private TimelineStore requireTimeline(String sessionId) {
    return sessionStore
        .get(sessionId)
        .map(EditSession::timeline)
        .orElseThrow(() -> new SessionNotFoundException(sessionId));
  }
}
