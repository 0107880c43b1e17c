package com.scholary.subtitle.editor.timeline;

/**
 * Outcome of a successful {@link TimelineStore#apply(Mutation)}.
 *
 * @param kind whether a subtitle was inserted or updated
 * @param subtitle the subtitle as committed
 * @param position its 0-based insertion-order position after the change
 * @param timelineSize number of subtitles on the timeline after the change
 */
public record AppliedResult(
    Mutation.Kind kind, Subtitle subtitle, int position, int timelineSize) {}
