package com.flamingo.ai.slunk.elasticsearch;

import com.flamingo.ai.slunk.domain.enums.DocumentKind;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A searchable entry in the message index: either a single message or a conversation chunk.
 *
 * <p>Chunk documents carry the ids of their member messages; their sender is the first
 * participant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageDocument {

  private String id;

  @Builder.Default private DocumentKind kind = DocumentKind.MESSAGE;

  private String channel;

  private String sender;

  private String threadId;

  /** Raw message text, or the chunk's key messages joined by newlines. */
  private String content;

  /** The text that was embedded. */
  private String enhancedText;

  @Builder.Default private List<String> keywords = new ArrayList<>();

  private List<Float> embedding;

  /** Message time, or the chunk start. */
  private Instant timestamp;

  private Map<String, Integer> reactions;

  @Builder.Default private int version = 1;

  /** Member message ids; empty for message documents. */
  @Builder.Default private List<String> memberIds = new ArrayList<>();

  /** Chunk participants; empty for message documents. */
  @Builder.Default private List<String> participants = new ArrayList<>();
}
