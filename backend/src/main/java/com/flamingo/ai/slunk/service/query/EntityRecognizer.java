package com.flamingo.ai.slunk.service.query;

import java.util.List;

/** Finds named entities in free text. */
public interface EntityRecognizer {

  /**
   * Recognizes entities in the text.
   *
   * @param text the query text, never null
   * @return recognized entities in order of appearance
   */
  List<RecognizedEntity> recognize(String text);
}
