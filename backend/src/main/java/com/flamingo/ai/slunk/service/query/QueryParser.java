package com.flamingo.ai.slunk.service.query;

import com.flamingo.ai.slunk.domain.enums.QueryIntent;
import com.flamingo.ai.slunk.service.text.KeywordExtractor;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns free query text into a {@link ParsedQuery}.
 *
 * <p>Parsing never fails: blank input yields an empty query with the default intent, and a
 * failing entity recognizer only costs the entities.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryParser {

  private static final String NAME =
      "[\\p{L}\\p{N}][\\p{L}\\p{N}_.-]*[\\p{L}\\p{N}]|[\\p{L}\\p{N}]";

  private static final Pattern HASH_CHANNEL = Pattern.compile("#(" + NAME + ")");
  private static final Pattern IN_CHANNEL =
      Pattern.compile("\\bin\\s+(?:the\\s+)?#?(" + NAME + ")\\s+channel\\b");
  private static final Pattern AT_USER = Pattern.compile("(?<![\\p{L}\\p{N}])@(" + NAME + ")");
  private static final Pattern FROM_USER =
      Pattern.compile("\\b(?:from|by)\\s+@?(" + NAME + ")");

  /** Words a "from X" / "by X" capture must never claim as a user name. */
  private static final Set<String> TEMPORAL_WORDS =
      ImmutableSet.of(
          "today", "yesterday", "tomorrow", "tonight", "this", "last", "past", "next", "week",
          "weeks", "month", "months", "year", "years", "day", "days", "morning", "afternoon",
          "evening", "monday", "tuesday", "wednesday", "thursday", "friday", "saturday",
          "sunday", "january", "february", "march", "april", "may", "june", "july", "august",
          "september", "october", "november", "december", "earlier", "recently", "ago");

  private final EntityRecognizer entityRecognizer;
  private final TemporalHintExtractor temporalHintExtractor;
  private final KeywordExtractor keywordExtractor;

  /**
   * Parses query text.
   *
   * @param text free text, may be null
   * @return the parsed query; never null
   */
  public ParsedQuery parse(String text) {
    if (text == null || text.isBlank()) {
      return ParsedQuery.empty(text);
    }
    String original = text.trim();
    String lower = original.toLowerCase(Locale.ROOT);
    List<String> tokens = keywordExtractor.tokenize(lower);
    Set<String> claimed = new HashSet<>();

    QueryIntent intent = QueryIntent.SEARCH;
    for (String token : tokens) {
      Optional<QueryIntent> match = QueryIntent.forToken(token);
      if (match.isPresent()) {
        intent = match.get();
        claimed.add(token);
        break;
      }
    }

    Set<String> channels = new LinkedHashSet<>();
    collect(HASH_CHANNEL, lower, channels);
    if (collect(IN_CHANNEL, lower, channels)) {
      claimed.add("channel");
    }

    Set<String> users = new LinkedHashSet<>();
    collect(AT_USER, lower, users);
    Matcher fromUser = FROM_USER.matcher(lower);
    while (fromUser.find()) {
      String candidate = fromUser.group(1);
      if (!TEMPORAL_WORDS.contains(candidate)
          && !keywordExtractor.isStopWord(candidate)
          && !candidate.chars().allMatch(Character::isDigit)
          && !channels.contains(candidate)) {
        users.add(candidate);
      }
    }

    channels.forEach(channel -> claimed.addAll(keywordExtractor.tokenize(channel)));
    users.forEach(user -> claimed.addAll(keywordExtractor.tokenize(user)));

    TemporalHint temporalHint = temporalHintExtractor.extract(lower).orElse(null);
    if (temporalHint != null) {
      claimed.addAll(keywordExtractor.tokenize(temporalHint.rawValue()));
    }

    List<String> keywords = new ArrayList<>();
    for (String keyword : keywordExtractor.extractKeywords(lower)) {
      if (!claimed.contains(keyword)) {
        keywords.add(keyword);
      }
    }

    ParsedQuery parsed =
        new ParsedQuery(
            original,
            intent,
            keywords,
            recognizeEntities(original),
            new ArrayList<>(channels),
            new ArrayList<>(users),
            temporalHint);
    log.debug(
        "Parsed query: intent={}, keywords={}, channels={}, users={}, temporal={}",
        parsed.intent(),
        parsed.keywords(),
        parsed.channels(),
        parsed.users(),
        temporalHint != null ? temporalHint.rawValue() : null);
    return parsed;
  }

  private List<RecognizedEntity> recognizeEntities(String text) {
    try {
      return entityRecognizer.recognize(text);
    } catch (RuntimeException e) {
      log.warn("Entity recognition failed, continuing without entities: {}", e.getMessage());
      return List.of();
    }
  }

  private static boolean collect(Pattern pattern, String text, Set<String> target) {
    Matcher matcher = pattern.matcher(text);
    boolean found = false;
    while (matcher.find()) {
      target.add(matcher.group(1));
      found = true;
    }
    return found;
  }
}
