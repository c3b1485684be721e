package com.flamingo.ai.slunk.service.ingestion;

import com.flamingo.ai.slunk.domain.entity.Message;
import com.flamingo.ai.slunk.domain.enums.DocumentKind;
import com.flamingo.ai.slunk.elasticsearch.MessageDocument;
import com.flamingo.ai.slunk.service.context.ConversationChunk;
import com.flamingo.ai.slunk.service.context.MessageContextualizer;
import com.flamingo.ai.slunk.service.search.MessageStore;
import com.flamingo.ai.slunk.service.text.KeywordExtractor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Builds index documents for messages and chunks and writes them to the {@link MessageStore}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageIndexer {

  private static final int CHUNK_KEYWORDS = 20;

  private final MessageContextualizer contextualizer;
  private final KeywordExtractor keywordExtractor;
  private final MessageStore messageStore;

  /** Embeds the message with its context and upserts it. */
  public void index(Message message) {
    messageStore.upsert(toDocument(message));
    log.debug("Indexed message {} version {}", message.getId(), message.getVersion());
  }

  MessageDocument toDocument(Message message) {
    return MessageDocument.builder()
        .id(message.getId())
        .kind(DocumentKind.MESSAGE)
        .channel(message.getChannel())
        .sender(message.getSender())
        .threadId(message.getThreadId())
        .content(message.getContent())
        .enhancedText(contextualizer.enhanceWithThreadContext(message))
        .keywords(keywordExtractor.extractKeywords(message.getContent()))
        .embedding(contextualizer.generateContextualEmbedding(message))
        .timestamp(message.getTimestamp())
        .reactions(message.getReactions())
        .version(message.getVersion())
        .build();
  }

  /**
   * Copies new reactions onto the indexed document without re-embedding.
   *
   * @return false when the message is not in the index yet
   */
  public boolean refreshReactions(Message message) {
    return messageStore
        .get(message.getId())
        .map(
            document -> {
              document.setReactions(
                  message.getReactions() == null ? null : new HashMap<>(message.getReactions()));
              messageStore.upsert(document);
              return true;
            })
        .orElse(false);
  }

  /** Embeds and upserts chunk documents in one bulk write. */
  public int indexChunks(List<ConversationChunk> chunks) {
    if (chunks.isEmpty()) {
      return 0;
    }
    List<MessageDocument> documents = chunks.stream().map(this::toDocument).toList();
    messageStore.upsertAll(documents);
    log.info("Indexed {} conversation chunks", documents.size());
    return documents.size();
  }

  MessageDocument toDocument(ConversationChunk chunk) {
    List<String> contents = chunk.messages().stream().map(Message::getContent).toList();
    Message first = chunk.messages().get(0);
    return MessageDocument.builder()
        .id(chunk.id())
        .kind(DocumentKind.CHUNK)
        .channel(first.getChannel())
        .sender(chunk.participants().get(0))
        .content(String.join("\n", contents))
        .enhancedText(contextualizer.chunkEmbeddingText(chunk))
        .keywords(keywordExtractor.topKeywords(contents, CHUNK_KEYWORDS))
        .embedding(contextualizer.generateChunkEmbedding(chunk))
        .timestamp(chunk.timeWindow().start())
        .memberIds(chunk.messages().stream().map(Message::getId).collect(Collectors.toList()))
        .participants(new ArrayList<>(chunk.participants()))
        .build();
  }
}
