package com.flamingo.ai.slunk.service.context;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Describes what a channel is usually about, from its name. */
@Component
public class ChannelTopics {

  private static final Map<String, String> TOPICS =
      ImmutableMap.<String, String>builder()
          .put("general", "General team discussions and announcements")
          .put("engineering", "Software development and technical discussions")
          .put("incident", "Incident response and outage coordination")
          .put("deployment", "Deployment discussions and releases")
          .put("release", "Release planning and release notes")
          .put("standup", "Daily standup meetings and updates")
          .put("bugs", "Bug reports and issue tracking")
          .put("api", "API development and integration")
          .put("random", "Casual conversations and non-work topics")
          .build();

  /**
   * Returns the topic for a channel: an exact name match first, then the first known name the
   * channel contains, then a generic description.
   */
  public String describe(String channel) {
    if (channel == null || channel.isBlank()) {
      return "Team discussions";
    }
    String name = channel.trim().toLowerCase(Locale.ROOT).replaceFirst("^#", "");
    String exact = TOPICS.get(name);
    if (exact != null) {
      return exact;
    }
    for (Map.Entry<String, String> entry : TOPICS.entrySet()) {
      if (name.contains(entry.getKey())) {
        return entry.getValue();
      }
    }
    return "Team discussions in #" + name;
  }
}
