package com.flamingo.ai.slunk.api.dto.response;

import com.flamingo.ai.slunk.domain.entity.Message;
import com.flamingo.ai.slunk.domain.enums.MessageType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stored message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponse {

  private String id;
  private String sender;
  private String content;
  private String channel;
  private String threadId;
  private MessageType messageType;
  private Instant timestamp;
  private Instant editedAt;
  private int version;
  private Map<String, Integer> reactions;
  private List<String> mentions;

  /** Creates a MessageResponse from a Message entity. */
  public static MessageResponse fromEntity(Message message) {
    return MessageResponse.builder()
        .id(message.getId())
        .sender(message.getSender())
        .content(message.getContent())
        .channel(message.getChannel())
        .threadId(message.getThreadId())
        .messageType(message.getMessageType())
        .timestamp(message.getTimestamp())
        .editedAt(message.getEditedAt())
        .version(message.getVersion())
        .reactions(message.getReactions())
        .mentions(message.getMentions())
        .build();
  }
}
