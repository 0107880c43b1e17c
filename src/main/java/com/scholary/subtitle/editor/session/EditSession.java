package com.scholary.subtitle.editor.session;

import com.scholary.subtitle.editor.timeline.TimelineStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * State of one editing session: its subtitle timeline and the chat that produced it.
 *
 * <p>Only requests that completed are recorded in the history, as a user message followed by the
 * reply.
 */
public class EditSession {

  private final TimelineStore timeline;
  private final List<ChatMessage> history = new ArrayList<>();

  public EditSession(TimelineStore timeline) {
    this.timeline = timeline;
  }

  public TimelineStore timeline() {
    return timeline;
  }

  /**
   * Append a user message and the reply it received.
   *
   * @param userMessage what the user wrote
   * @param reply what was answered
   */
  public synchronized void recordExchange(String userMessage, String reply) {
    Instant now = Instant.now();
    history.add(new ChatMessage(ChatMessage.Author.USER, userMessage, now));
    history.add(new ChatMessage(ChatMessage.Author.AI, reply, now));
  }

  /** Immutable copy of the chat history, oldest first. */
  public synchronized List<ChatMessage> history() {
    return List.copyOf(history);
  }
}
