package com.flamingo.ai.slunk.service.query;

/**
 * Named entity found in query text.
 *
 * @param text surface form
 * @param type entity class
 */
public record RecognizedEntity(String text, EntityType type) {

  /** Supported entity classes. */
  public enum EntityType {
    PERSON,
    ORGANIZATION,
    PLACE
  }
}
