package com.scholary.subtitle.editor.session;

/** Thrown when a session id is unknown or its session has expired. */
public class SessionNotFoundException extends RuntimeException {

  public SessionNotFoundException(String sessionId) {
    super(String.format("Session %s not found or expired", sessionId));
  }
}
