package com.flamingo.ai.slunk.support;

import com.flamingo.ai.slunk.domain.entity.Message;
import java.time.Instant;
import java.util.ArrayList;

/** Builders for test messages. */
public final class TestMessages {

  private TestMessages() {}

  public static Message message(String id, String sender, String content, Instant timestamp) {
    return Message.builder()
        .id(id)
        .sender(sender)
        .content(content)
        .channel("engineering")
        .timestamp(timestamp)
        .mentions(new ArrayList<>())
        .attachmentNames(new ArrayList<>())
        .build();
  }

  public static Message reply(
      String id, String threadId, String sender, String content, Instant timestamp) {
    Message message = message(id, sender, content, timestamp);
    message.setThreadId(threadId);
    return message;
  }
}
