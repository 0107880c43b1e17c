package com.scholary.subtitle.editor.timeline;

/**
 * Base class for mutations the timeline refuses to apply.
 *
 * <p>When one of these is thrown the timeline is exactly as it was before the call.
 */
public abstract class TimelineMutationException extends RuntimeException {

  protected TimelineMutationException(String message) {
    super(message);
  }
}
