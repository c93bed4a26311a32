package com.flamingo.ai.notesearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/** Entry point for the note search service. */
@SpringBootApplication
@ConfigurationPropertiesScan
public class NoteSearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(NoteSearchApplication.class, args);
  }
}
