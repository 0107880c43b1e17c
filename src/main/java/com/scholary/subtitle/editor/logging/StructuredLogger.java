package com.scholary.subtitle.editor.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets an {@code event_type} plus its own fields for the duration of one log call,
 * so they can be queried in the log backend alongside the session context.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a committed timeline mutation. */
  public void logMutationApplied(
      String intent, String kind, String subtitleId, int position, int timelineSize) {
    try {
      MDC.put("event_type", "mutation_applied");
      MDC.put("intent", intent);
      MDC.put("mutationKind", kind);
      MDC.put("subtitleId", subtitleId);
      MDC.put("position", String.valueOf(position));
      MDC.put("timelineSize", String.valueOf(timelineSize));

      logger.info(
          "Mutation applied: intent={}, kind={}, subtitle={}, position={}, timelineSize={}",
          intent,
          kind,
          subtitleId,
          position,
          timelineSize);
    } finally {
      clearEventFields();
    }
  }

  /** Log a request whose edit was refused; the timeline is unchanged. */
  public void logMutationRejected(String intent, String errorType, String message) {
    try {
      MDC.put("event_type", "mutation_rejected");
      MDC.put("intent", intent);
      MDC.put("errorType", errorType);

      logger.warn(
          "Mutation rejected: intent={}, error={}, message={}", intent, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a silence compaction committed to a session's timeline. */
  public void logTimelineCompacted(
      int silentSegments,
      double silenceSeconds,
      int keepIntervals,
      int subtitlesKept,
      int subtitlesDropped) {
    try {
      MDC.put("event_type", "timeline_compacted");
      MDC.put("silentSegments", String.valueOf(silentSegments));
      MDC.put("silenceSeconds", String.valueOf(silenceSeconds));
      MDC.put("keepIntervals", String.valueOf(keepIntervals));
      MDC.put("subtitlesKept", String.valueOf(subtitlesKept));
      MDC.put("subtitlesDropped", String.valueOf(subtitlesDropped));

      logger.info(
          "Timeline compacted: silences={}, removed={}s, keepIntervals={}, subtitles kept={},"
              + " dropped={}",
          silentSegments,
          silenceSeconds,
          keepIntervals,
          subtitlesKept,
          subtitlesDropped);
    } finally {
      clearEventFields();
    }
  }

  /** Set session context in MDC. */
  public static void setSessionContext(String sessionId) {
    MDC.put("sessionId", sessionId);
  }

  /** Clear session context from MDC. */
  public static void clearSessionContext() {
    MDC.remove("sessionId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("intent");
    MDC.remove("mutationKind");
    MDC.remove("subtitleId");
    MDC.remove("position");
    MDC.remove("timelineSize");
    MDC.remove("errorType");
    MDC.remove("silentSegments");
    MDC.remove("silenceSeconds");
    MDC.remove("keepIntervals");
    MDC.remove("subtitlesKept");
    MDC.remove("subtitlesDropped");
  }
}
