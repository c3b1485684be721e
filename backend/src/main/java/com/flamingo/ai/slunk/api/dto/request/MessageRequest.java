package com.flamingo.ai.slunk.api.dto.request;

import com.flamingo.ai.slunk.domain.entity.Message;
import com.flamingo.ai.slunk.domain.enums.MessageType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting one captured message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageRequest {

  /** Source message id, if the chat platform exposes one. */
  @Size(max = 255, message = "Message id must not exceed 255 characters")
  private String id;

  @NotBlank(message = "Sender is required")
  @Size(max = 255, message = "Sender must not exceed 255 characters")
  private String sender;

  @NotBlank(message = "Content is required")
  @Size(max = 40000, message = "Content must not exceed 40000 characters")
  private String content;

  @NotBlank(message = "Channel is required")
  @Size(max = 255, message = "Channel must not exceed 255 characters")
  private String channel;

  @NotNull(message = "Timestamp is required")
  private Instant timestamp;

  private String threadId;

  private String workspace;

  private MessageType messageType;

  private Instant editedAt;

  /** Emoji to count; omit when reactions were not captured. */
  private Map<String, Integer> reactions;

  private List<String> mentions;

  private List<String> attachmentNames;

  /** Creates an unsaved Message from this request. */
  public Message toMessage() {
    return Message.builder()
        .id(id)
        .sender(sender)
        .content(content)
        .channel(channel)
        .timestamp(timestamp)
        .threadId(threadId)
        .workspace(workspace)
        .messageType(messageType != null ? messageType : MessageType.REGULAR)
        .editedAt(editedAt)
        .reactions(reactions)
        .mentions(mentions != null ? new ArrayList<>(mentions) : new ArrayList<>())
        .attachmentNames(
            attachmentNames != null ? new ArrayList<>(attachmentNames) : new ArrayList<>())
        .build();
  }
}
