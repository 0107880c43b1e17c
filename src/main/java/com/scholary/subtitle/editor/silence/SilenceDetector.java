package com.scholary.subtitle.editor.silence;

import java.nio.file.Path;

/**
 * Detects silent intervals in a media file.
 *
 * <p>Implementations run an external tool (ffmpeg's silencedetect filter, for example); the
 * compaction logic only consumes what they report.
 */
public interface SilenceDetector {

  /**
   * Detect silence in a media file.
   *
   * @param mediaFile the media to analyze
   * @return sorted, non-overlapping silent intervals plus the media duration
   */
  SilenceDetection detect(Path mediaFile);
}
