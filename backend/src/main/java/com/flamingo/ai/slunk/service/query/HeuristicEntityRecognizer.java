package com.flamingo.ai.slunk.service.query;

import com.flamingo.ai.slunk.domain.enums.QueryIntent;
import com.flamingo.ai.slunk.service.query.RecognizedEntity.EntityType;
import com.flamingo.ai.slunk.service.text.KeywordExtractor;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Recognizes entities from capitalized word spans.
 *
 * <p>A span ending in an organization suffix, or written in capitals, is an organization; a span
 * found in the place gazetteer is a place; anything else is a person. Leading words that are
 * only capitalized because they start the sentence are dropped.
 */
@Component
@RequiredArgsConstructor
public class HeuristicEntityRecognizer implements EntityRecognizer {

  private static final Pattern CAPITALIZED_SPAN =
      Pattern.compile("\\b\\p{Lu}[\\p{L}\\p{N}&'-]*(?:\\s+\\p{Lu}[\\p{L}\\p{N}&'-]*)*");

  private static final Set<String> ORGANIZATION_SUFFIXES =
      ImmutableSet.of(
          "inc", "corp", "corporation", "llc", "ltd", "co", "company", "labs", "group",
          "foundation", "team", "university", "institute");

  private static final Set<String> PLACES =
      ImmutableSet.of(
          "london", "paris", "berlin", "tokyo", "new york", "san francisco", "seattle", "boston",
          "austin", "chicago", "toronto", "sydney", "singapore", "dublin", "amsterdam", "europe",
          "asia", "africa", "america", "usa", "uk", "germany", "france", "india", "china",
          "japan", "canada", "brazil", "australia");

  private static final Set<String> NON_ENTITY_WORDS =
      ImmutableSet.of(
          "today", "yesterday", "monday", "tuesday", "wednesday", "thursday", "friday",
          "saturday", "sunday", "january", "february", "march", "april", "may", "june", "july",
          "august", "september", "october", "november", "december", "please", "hey", "hi",
          "thanks", "ok", "okay");

  private final KeywordExtractor keywordExtractor;

  @Override
  public List<RecognizedEntity> recognize(String text) {
    List<RecognizedEntity> entities = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return entities;
    }
    Set<String> seen = new LinkedHashSet<>();
    Matcher matcher = CAPITALIZED_SPAN.matcher(text);
    while (matcher.find()) {
      if (matcher.start() > 0) {
        char previous = text.charAt(matcher.start() - 1);
        if (previous == '#' || previous == '@') {
          continue;
        }
      }
      String span = trimLeadingCommonWords(matcher.group());
      if (span.isEmpty() || !seen.add(span.toLowerCase(Locale.ROOT))) {
        continue;
      }
      entities.add(new RecognizedEntity(span, classify(span)));
    }
    return entities;
  }

  private String trimLeadingCommonWords(String span) {
    List<String> words = new ArrayList<>(Arrays.asList(span.trim().split("\\s+")));
    while (!words.isEmpty() && isCommonWord(words.get(0))) {
      words.remove(0);
    }
    return String.join(" ", words);
  }

  private boolean isCommonWord(String word) {
    String lower = word.toLowerCase(Locale.ROOT);
    return keywordExtractor.isStopWord(lower)
        || NON_ENTITY_WORDS.contains(lower)
        || QueryIntent.forToken(lower).isPresent();
  }

  private EntityType classify(String span) {
    String lower = span.toLowerCase(Locale.ROOT);
    if (PLACES.contains(lower)) {
      return EntityType.PLACE;
    }
    String[] words = lower.split("\\s+");
    String lastWord = words[words.length - 1].replace(".", "");
    if (words.length > 1 && ORGANIZATION_SUFFIXES.contains(lastWord)) {
      return EntityType.ORGANIZATION;
    }
    if (span.length() > 1 && span.equals(span.toUpperCase(Locale.ROOT))) {
      return EntityType.ORGANIZATION;
    }
    return EntityType.PERSON;
  }
}
