package com.flamingo.ai.slunk.domain.entity;

import com.flamingo.ai.slunk.domain.converter.ReactionMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Last seen state of one logical message identity. One row per dedup key. */
@Entity
@Table(name = "deduplication_records")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeduplicationRecord {

  @Id
  @Column(length = 512)
  private String dedupKey;

  @Column(nullable = false)
  private String messageId;

  @Column(nullable = false)
  private String contentHash;

  @Column(nullable = false)
  private int version;

  @Convert(converter = ReactionMapConverter.class)
  @Column(columnDefinition = "TEXT")
  private Map<String, Integer> lastReactions;

  @Column(nullable = false)
  private Instant updatedAt;
}
