package com.scholary.subtitle.editor.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * In-memory session store backed by a Caffeine cache.
 *
 * <p>Entries expire after a period without access, so an active editing session stays alive
 * while an abandoned one is reclaimed. Size is bounded to keep memory in check.
 */
@Repository
public class CaffeineSessionStore implements SessionStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaffeineSessionStore.class);

  private final Cache<String, EditSession> cache;

  public CaffeineSessionStore(SessionProperties properties) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(properties.maxSize())
            .expireAfterAccess(Duration.ofMinutes(properties.expireAfterMinutes()))
            .build();

    LOGGER.info(
        "Initialized session store: maxSize={}, expireAfterMinutes={}",
        properties.maxSize(),
        properties.expireAfterMinutes());
  }

  @Override
  public Optional<EditSession> get(String sessionId) {
    return Optional.ofNullable(cache.getIfPresent(sessionId));
  }

  @Override
  public void put(String sessionId, EditSession session) {
    cache.put(sessionId, session);
    LOGGER.debug("Stored session: {} ({} active)", sessionId, estimatedSize());
  }

  @Override
  public void remove(String sessionId) {
    cache.invalidate(sessionId);
    LOGGER.debug("Removed session: {}", sessionId);
  }

  public long estimatedSize() {
    return cache.estimatedSize();
  }
}
