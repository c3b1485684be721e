package com.flamingo.ai.slunk.api.dto.response;

import com.flamingo.ai.slunk.domain.entity.Message;
import com.flamingo.ai.slunk.service.context.ConversationChunk;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a conversation chunk. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResponse {

  private String id;
  private String topic;
  private String summary;
  private Instant start;
  private Instant end;
  private List<String> participants;
  private List<String> messageIds;
  private int messageCount;

  /** Creates a ChunkResponse from a ConversationChunk. */
  public static ChunkResponse fromChunk(ConversationChunk chunk) {
    return ChunkResponse.builder()
        .id(chunk.id())
        .topic(chunk.topic())
        .summary(chunk.summary())
        .start(chunk.timeWindow().start())
        .end(chunk.timeWindow().end())
        .participants(chunk.participants())
        .messageIds(chunk.messages().stream().map(Message::getId).toList())
        .messageCount(chunk.messages().size())
        .build();
  }
}
