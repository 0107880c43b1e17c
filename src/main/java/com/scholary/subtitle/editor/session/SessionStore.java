package com.scholary.subtitle.editor.session;

import java.util.Optional;

/**
 * Key-value store of editing sessions by session id.
 *
 * <p>Expiry is the implementation's business; callers treat an expired session as absent.
 */
public interface SessionStore {

  /**
   * Look up a session.
   *
   * @param sessionId the session id
   * @return the session, or empty if it does not exist or has expired
   */
  Optional<EditSession> get(String sessionId);

  /**
   * Store a session, replacing any previous one under the same id.
   *
   * @param sessionId the session id
   * @param session the session
   */
  void put(String sessionId, EditSession session);

  /**
   * Remove a session.
   *
   * @param sessionId the session id
   */
  void remove(String sessionId);
}
