package com.flamingo.ai.slunk.service.chunk;

import com.flamingo.ai.slunk.config.SlunkConfig;
import com.flamingo.ai.slunk.domain.entity.Message;
import com.flamingo.ai.slunk.domain.repository.MessageRepository;
import com.flamingo.ai.slunk.exception.MessageNotFoundException;
import com.flamingo.ai.slunk.service.context.ConversationChunk;
import com.flamingo.ai.slunk.service.context.MessageContextualizer;
import com.flamingo.ai.slunk.service.ingestion.MessageIndexer;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Builds conversation chunks on request and optionally indexes them for search. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationChunkService {

  private final MessageContextualizer contextualizer;
  private final MessageRepository messageRepository;
  private final MessageIndexer messageIndexer;
  private final SlunkConfig slunkConfig;

  /**
   * Groups the given messages into chunks.
   *
   * @param messages messages in any order
   * @param timeWindow maximum chunk span, or {@code null} for the configured one
   * @param maxChunkSize maximum members per chunk, or {@code null} for the configured one
   * @param index whether to write the chunks to the search index
   * @return chunks in time order
   */
  @Timed(value = "chunks.create", description = "Time to build conversation chunks")
  public List<ConversationChunk> createChunks(
      List<Message> messages, Duration timeWindow, Integer maxChunkSize, boolean index) {
    SlunkConfig.Chunking defaults = slunkConfig.getChunking();
    List<ConversationChunk> chunks =
        contextualizer.createConversationChunks(
            messages,
            timeWindow != null ? timeWindow : defaults.getTimeWindow(),
            maxChunkSize != null ? maxChunkSize : defaults.getMaxChunkSize());
    if (index && !chunks.isEmpty()) {
      messageIndexer.indexChunks(chunks);
    }
    return chunks;
  }

  /**
   * Loads stored messages by id, in the requested order.
   *
   * @throws MessageNotFoundException for the first unknown id
   */
  @Transactional(readOnly = true)
  public List<Message> loadMessages(Collection<String> messageIds) {
    Map<String, Message> found =
        messageRepository.findAllById(messageIds).stream()
            .collect(Collectors.toMap(Message::getId, Function.identity()));
    List<Message> ordered = new ArrayList<>(messageIds.size());
    for (String id : messageIds) {
      Message message = found.get(id);
      if (message == null) {
        throw new MessageNotFoundException(id);
      }
      ordered.add(message);
    }
    return ordered;
  }
}
