package com.flamingo.ai.slunk.domain.entity;

import com.flamingo.ai.slunk.domain.converter.ReactionMapConverter;
import com.flamingo.ai.slunk.domain.converter.StringListConverter;
import com.flamingo.ai.slunk.domain.enums.MessageType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A single captured chat message. Mutated only through the deduplication update paths. */
@Entity
@Table(
    name = "messages",
    indexes = {
      @Index(name = "idx_messages_thread", columnList = "thread_id"),
      @Index(name = "idx_messages_channel_ts", columnList = "channel, sent_at")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Message {

  @Id private String id;

  /** Logical identity used by the deduplication gate. */
  @Column(nullable = false, unique = true, length = 512)
  private String dedupKey;

  @Column(name = "sent_at", nullable = false)
  private Instant timestamp;

  @Column(nullable = false)
  private String sender;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String content;

  @Column(nullable = false)
  private String channel;

  @Column(name = "thread_id")
  private String threadId;

  private String workspace;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private MessageType messageType = MessageType.REGULAR;

  private Instant editedAt;

  /** Emoji to count; {@code null} when reactions were never captured. */
  @Convert(converter = ReactionMapConverter.class)
  @Column(columnDefinition = "TEXT")
  private Map<String, Integer> reactions;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> mentions = new ArrayList<>();

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> attachmentNames = new ArrayList<>();

  @Column(nullable = false)
  private String contentHash;

  @Column(nullable = false)
  @Builder.Default
  private int version = 1;

  /** True once the index write for the current version succeeded. */
  @Builder.Default private boolean indexed = false;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  /** Whether this message belongs to a thread. */
  public boolean isInThread() {
    return threadId != null && !threadId.isBlank();
  }
}
