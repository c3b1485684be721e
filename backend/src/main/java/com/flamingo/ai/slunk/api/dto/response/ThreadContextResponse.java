package com.flamingo.ai.slunk.api.dto.response;

import com.flamingo.ai.slunk.service.context.ThreadContext;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a thread context. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreadContextResponse {

  private String threadId;
  private MessageResponse parentMessage;
  private List<MessageResponse> recentMessages;
  private long totalMessageCount;

  /** Creates a ThreadContextResponse from a ThreadContext. */
  public static ThreadContextResponse fromContext(ThreadContext context) {
    return ThreadContextResponse.builder()
        .threadId(context.threadId())
        .parentMessage(
            context.parentMessage() != null
                ? MessageResponse.fromEntity(context.parentMessage())
                : null)
        .recentMessages(context.recentMessages().stream().map(MessageResponse::fromEntity).toList())
        .totalMessageCount(context.totalMessageCount())
        .build();
  }
}
