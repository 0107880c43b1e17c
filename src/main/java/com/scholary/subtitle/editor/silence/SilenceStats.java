package com.scholary.subtitle.editor.silence;

/**
 * Summary of how much a compaction removes. All values are rounded to 2 decimals.
 *
 * @param totalSilenceDuration seconds of silence removed
 * @param silencePercentage share of the total duration that is silence, 0-100
 * @param silentSegments number of silent intervals
 * @param totalDuration duration before compaction
 * @param durationAfterRemoval duration after compaction
 */
public record SilenceStats(
    double totalSilenceDuration,
    double silencePercentage,
    int silentSegments,
    double totalDuration,
    double durationAfterRemoval) {}
