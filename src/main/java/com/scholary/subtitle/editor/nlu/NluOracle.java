package com.scholary.subtitle.editor.nlu;

/**
 * Natural-language understanding for edit requests, typically a language model.
 *
 * <p>This abstraction lets us swap model providers without touching the edit pipeline. Replies
 * are untrusted: the intent may be anything and the parameters may not even be JSON.
 */
public interface NluOracle {

  /**
   * Interpret a user's chat message.
   *
   * @param userMessage the message as typed or dictated
   * @param timelineContext a plain-text description of the current timeline
   * @return the guessed intent and the raw parameter text
   */
  OracleReply interpret(String userMessage, String timelineContext);
}
