package com.flamingo.ai.slunk.service.context;

import com.flamingo.ai.slunk.domain.entity.Message;
import java.util.List;

/**
 * Parent and recent history of a reply thread.
 *
 * @param threadId the thread identifier
 * @param parentMessage the message that started the thread, or {@code null} if never captured
 * @param recentMessages the latest replies in conversation order, bounded by the configured window
 * @param totalMessageCount every known message of the thread, parent included
 */
public record ThreadContext(
    String threadId, Message parentMessage, List<Message> recentMessages, long totalMessageCount) {

  public ThreadContext {
    recentMessages = List.copyOf(recentMessages);
  }
}
