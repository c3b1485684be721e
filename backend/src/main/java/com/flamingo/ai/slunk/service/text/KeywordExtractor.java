package com.flamingo.ai.slunk.service.text;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Tokenizes message and query text into lower-cased content keywords. */
@Component
public class KeywordExtractor {

  private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+(?:['_-][\\p{L}\\p{N}]+)*");

  private static final int MIN_KEYWORD_LENGTH = 2;

  static final Set<String> STOP_WORDS =
      ImmutableSet.of(
          "a", "an", "the", "and", "or", "but", "nor", "so", "yet", "in", "on", "at", "to", "for",
          "of", "with", "by", "from", "into", "about", "as", "is", "are", "was", "were", "be",
          "been", "being", "am", "do", "does", "did", "done", "have", "has", "had", "it", "its",
          "this", "that", "these", "those", "there", "here", "i", "me", "my", "we", "us", "our",
          "you", "your", "he", "him", "his", "she", "her", "they", "them", "their", "what",
          "which", "who", "whom", "when", "how", "why", "all", "any", "some", "only", "just",
          "can", "could", "would", "should", "will", "shall", "may", "might", "must", "not", "no",
          "yes", "if", "then", "than", "too", "very", "up", "out", "over", "said", "say", "says",
          "talk", "talked", "talking", "mention", "mentioned", "message", "messages",
          "conversation", "conversations", "anything", "something", "everything", "also");

  /** Splits text into lower-cased word tokens, keeping order and duplicates. */
  public List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return tokens;
    }
    Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      tokens.add(matcher.group());
    }
    return tokens;
  }

  /** Returns distinct content keywords in first-seen order. */
  public List<String> extractKeywords(String text) {
    Set<String> keywords = new LinkedHashSet<>();
    for (String token : tokenize(text)) {
      if (isContentWord(token)) {
        keywords.add(token);
      }
    }
    return new ArrayList<>(keywords);
  }

  /**
   * Returns up to {@code limit} most frequent content keywords across the texts. Ties keep the
   * order in which keywords were first seen.
   */
  public List<String> topKeywords(Collection<String> texts, int limit) {
    Map<String, Integer> frequencies = new LinkedHashMap<>();
    for (String text : texts) {
      for (String token : tokenize(text)) {
        if (isContentWord(token)) {
          frequencies.merge(token, 1, Integer::sum);
        }
      }
    }
    return frequencies.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
        .limit(limit)
        .map(Map.Entry::getKey)
        .toList();
  }

  public boolean isStopWord(String token) {
    return STOP_WORDS.contains(token.toLowerCase(Locale.ROOT));
  }

  private boolean isContentWord(String token) {
    return token.length() >= MIN_KEYWORD_LENGTH && !STOP_WORDS.contains(token);
  }
}
