package com.flamingo.ai.slunk.service.search;

import com.flamingo.ai.slunk.domain.enums.DocumentKind;
import com.flamingo.ai.slunk.elasticsearch.MessageDocument;
import com.flamingo.ai.slunk.service.query.DateRange;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hard constraints every search candidate must satisfy.
 *
 * @param channels allowed channels, lower-case; empty means any
 * @param users allowed senders, lower-case; empty means any
 * @param dateRange explicit time constraint, or {@code null}
 * @param includeChunks whether chunk documents may be returned
 */
public record SearchFilters(
    Set<String> channels, Set<String> users, DateRange dateRange, boolean includeChunks) {

  public static final SearchFilters NONE = new SearchFilters(Set.of(), Set.of(), null, false);

  public SearchFilters {
    channels = normalize(channels);
    users = normalize(users);
  }

  /** Returns a copy with extra channels and users merged in. */
  public SearchFilters withAdditional(Set<String> moreChannels, Set<String> moreUsers) {
    Set<String> mergedChannels = new LinkedHashSet<>(channels);
    mergedChannels.addAll(normalize(moreChannels));
    Set<String> mergedUsers = new LinkedHashSet<>(users);
    mergedUsers.addAll(normalize(moreUsers));
    return new SearchFilters(mergedChannels, mergedUsers, dateRange, includeChunks);
  }

  /** Re-checks a store result against these filters. */
  public boolean accepts(MessageDocument document) {
    if (document.getKind() == DocumentKind.CHUNK && !includeChunks) {
      return false;
    }
    if (!channels.isEmpty() && !matches(channels, document.getChannel())) {
      return false;
    }
    if (!users.isEmpty()) {
      boolean senderMatches = matches(users, document.getSender());
      boolean participantMatches =
          document.getParticipants() != null
              && document.getParticipants().stream()
                  .anyMatch(participant -> matches(users, participant));
      if (!senderMatches && !participantMatches) {
        return false;
      }
    }
    return dateRange == null
        || (document.getTimestamp() != null && dateRange.contains(document.getTimestamp()));
  }

  private static boolean matches(Set<String> allowed, String value) {
    return value != null && allowed.contains(value.toLowerCase(Locale.ROOT));
  }

  private static Set<String> normalize(Set<String> values) {
    if (values == null) {
      return Set.of();
    }
    return values.stream()
        .filter(value -> value != null && !value.isBlank())
        .map(value -> value.trim().toLowerCase(Locale.ROOT).replaceFirst("^[#@]", ""))
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }
}
