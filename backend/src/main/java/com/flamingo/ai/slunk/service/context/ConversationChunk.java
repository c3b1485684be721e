package com.flamingo.ai.slunk.service.context;

import com.flamingo.ai.slunk.domain.entity.Message;
import java.time.Instant;
import java.util.List;

/**
 * Time- and size-bounded run of messages treated as one topical unit.
 *
 * @param id deterministic identifier derived from the member message ids
 * @param topic up to three dominant keywords, or "general discussion"
 * @param messages members in ascending timestamp order; never empty
 * @param timeWindow first and last member timestamps
 * @param participants distinct senders in first-seen order
 * @param summary templated description of the chunk
 */
public record ConversationChunk(
    String id,
    String topic,
    List<Message> messages,
    TimeWindow timeWindow,
    List<String> participants,
    String summary) {

  public ConversationChunk {
    if (messages.isEmpty()) {
      throw new IllegalArgumentException("A conversation chunk needs at least one message");
    }
    messages = List.copyOf(messages);
    participants = List.copyOf(participants);
  }

  public int participantCount() {
    return participants.size();
  }

  /**
   * Closed interval spanned by a chunk.
   *
   * @param start first member timestamp
   * @param end last member timestamp
   */
  public record TimeWindow(Instant start, Instant end) {}
}
