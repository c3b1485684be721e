package com.flamingo.ai.slunk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the Slunk contextual search service. */
@SpringBootApplication
public class SlunkApplication {

  public static void main(String[] args) {
    SpringApplication.run(SlunkApplication.class, args);
  }
}
