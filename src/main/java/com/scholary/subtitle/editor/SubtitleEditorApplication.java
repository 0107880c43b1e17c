package com.scholary.subtitle.editor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SubtitleEditorApplication {

  public static void main(String[] args) {
    SpringApplication.run(SubtitleEditorApplication.class, args);
  }
}
