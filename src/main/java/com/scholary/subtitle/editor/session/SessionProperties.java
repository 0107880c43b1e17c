package com.scholary.subtitle.editor.session;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the in-memory session store.
 *
 * <p>Sessions idle for longer than {@code expireAfterMinutes} are evicted.
 */
@ConfigurationProperties(prefix = "session")
@Validated
public record SessionProperties(@Positive int maxSize, @Positive int expireAfterMinutes) {}
