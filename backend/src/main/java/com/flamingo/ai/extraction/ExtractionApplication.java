package com.flamingo.ai.extraction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Structured extraction service. */
@SpringBootApplication
public class ExtractionApplication {

  public static void main(String[] args) {
    SpringApplication.run(ExtractionApplication.class, args);
  }
}
