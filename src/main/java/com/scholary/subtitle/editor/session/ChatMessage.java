package com.scholary.subtitle.editor.session;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a session's chat history.
 *
 * @param author who wrote the message
 * @param content the message text
 * @param timestamp when the message was recorded
 */
public record ChatMessage(Author author, String content, Instant timestamp) {

  public enum Author {
    USER,
    AI
  }

  public ChatMessage {
    Objects.requireNonNull(author, "author");
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
