package com.scholary.subtitle.editor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.subtitle.editor.edit.SubtitleDefaultsProperties;
import com.scholary.subtitle.editor.nlu.NluOracle;
import com.scholary.subtitle.editor.session.SessionProperties;
import com.scholary.subtitle.editor.silence.SilenceDetector;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the editing core.
 *
 * <p>Enables the properties records to be loaded from application.yml. The oracle and the silence
 * detector are provided by the hosting application; until one is registered, the placeholders
 * below fail each call with a clear message instead of failing startup.
 */
@Configuration
@EnableConfigurationProperties({SubtitleDefaultsProperties.class, SessionProperties.class})
public class EditorConfig {

  @Bean
  @ConditionalOnMissingBean
  public ObjectMapper objectMapper() {
    return new ObjectMapper();
  }

  @Bean
  @ConditionalOnMissingBean
  public NluOracle nluOracle() {
    return (message, context) -> {
      throw new IllegalStateException("No NLU oracle configured");
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public SilenceDetector silenceDetector() {
    return mediaFile -> {
      throw new IllegalStateException("No silence detector configured");
    };
  }
}
