package com.flamingo.ai.slunk.service.context;

import com.flamingo.ai.slunk.config.SlunkConfig;
import com.flamingo.ai.slunk.domain.entity.Message;
import com.flamingo.ai.slunk.domain.repository.MessageRepository;
import com.flamingo.ai.slunk.exception.MessageNotFoundException;
import com.flamingo.ai.slunk.service.embedding.EmbeddingProvider;
import com.flamingo.ai.slunk.service.text.KeywordExtractor;
import com.google.common.hash.Hashing;
import io.micrometer.core.annotation.Timed;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Rewrites low-signal messages into embeddable text and groups messages into conversation
 * chunks.
 *
 * <p>Short messages ("👍", "lgtm", "done") say little on their own. When such a message sits in a
 * thread, the text that gets embedded quotes the thread parent and the latest replies around it;
 * every other message is embedded with a channel, time and sender header so all vectors are built
 * from the same layout.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageContextualizer {

  static final String GENERAL_TOPIC = "general discussion";

  private static final int TOPIC_KEYWORDS = 3;
  private static final int CHUNK_KEY_MESSAGES = 3;
  private static final String PATTERN = "EEE yyyy-MM-dd HH:mm VV";

  private final EmbeddingProvider embeddingProvider;
  private final ThreadContextService threadContextService;
  private final MessageRepository messageRepository;
  private final KeywordExtractor keywordExtractor;
  private final ChannelTopics channelTopics;
  private final SlunkConfig slunkConfig;
  private final Clock clock;

  /**
   * Returns the text to embed for a message, looking up its thread context.
   *
   * @param message the message
   * @return labeled, never-empty text
   */
  public String enhanceWithThreadContext(Message message) {
    Optional<ThreadContext> context =
        message.isInThread()
            ? threadContextService.getThreadContext(message.getThreadId())
            : Optional.empty();
    return enhance(message, context.orElse(null));
  }

  /**
   * Returns the text to embed for a message given an already loaded thread context.
   *
   * @param message the message
   * @param threadContext the thread context, or {@code null}
   * @return labeled, never-empty text
   */
  public String enhance(Message message, ThreadContext threadContext) {
    if (isShortMessage(message.getContent()) && hasUsableContext(message, threadContext)) {
      return threadDescription(message, threadContext);
    }
    return channelDescription(message);
  }

  /**
   * Glosses a short message.
   *
   * @param message the message
   * @param threadContext the thread context, or {@code null}
   * @return the gloss, or {@code null} when the message is not short or nothing can be said
   */
  public String extractContextualMeaning(Message message, ThreadContext threadContext) {
    String content = message.getContent();
    if (!isShortMessage(content)) {
      return null;
    }
    Message parent = usableParent(message, threadContext);
    Optional<ShortMessageMeaning> meaning = ShortMessageMeaning.lookup(content);
    if (meaning.isPresent()) {
      if (parent == null) {
        return meaning.get().getGloss();
      }
      return meaning.get().getGloss()
          + " "
          + connector(meaning.get().getCategory())
          + ": "
          + parent.getContent();
    }
    if (parent != null) {
      return "Short response '" + content.trim() + "' to: " + parent.getContent();
    }
    return null;
  }

  /**
   * Glosses a stored message using its thread context.
   *
   * @param messageId the message id
   * @return the gloss, or empty when the message has none
   * @throws MessageNotFoundException when the id is unknown
   */
  @Transactional(readOnly = true)
  public Optional<String> getContextualMeaning(String messageId) {
    Message message =
        messageRepository
            .findById(messageId)
            .orElseThrow(() -> new MessageNotFoundException(messageId));
    ThreadContext context =
        message.isInThread()
            ? threadContextService.getThreadContext(message.getThreadId()).orElse(null)
            : null;
    return Optional.ofNullable(extractContextualMeaning(message, context));
  }

  /**
   * Whether a message is too short to embed meaningfully on its own: at most the configured number
   * of code points, or a glossary entry.
   */
  public boolean isShortMessage(String content) {
    if (content == null) {
      return false;
    }
    String trimmed = content.trim();
    if (trimmed.isEmpty()) {
      return false;
    }
    int threshold = slunkConfig.getContextualizer().getShortMessageThreshold();
    return trimmed.codePointCount(0, trimmed.length()) <= threshold
        || ShortMessageMeaning.lookup(trimmed).isPresent();
  }

  /**
   * Groups messages into conversation chunks.
   *
   * <p>Messages are processed in ascending timestamp order (stable for equal timestamps). A new
   * chunk starts when a message is more than {@code timeWindow} after the first message of the
   * current chunk, or when the current chunk already holds {@code maxChunkSize} messages.
   *
   * @param messages messages in any order
   * @param timeWindow maximum span of a chunk
   * @param maxChunkSize maximum number of messages per chunk, at least 1
   * @return chunks in time order; every input message appears in exactly one chunk
   */
  @Timed(value = "contextualizer.chunks", description = "Time to build conversation chunks")
  public List<ConversationChunk> createConversationChunks(
      List<Message> messages, Duration timeWindow, int maxChunkSize) {
    if (maxChunkSize < 1) {
      throw new IllegalArgumentException("maxChunkSize must be at least 1");
    }
    if (timeWindow.isNegative()) {
      throw new IllegalArgumentException("timeWindow must not be negative");
    }

    List<Message> sorted = new ArrayList<>(messages);
    sorted.sort(Comparator.comparing(Message::getTimestamp));

    List<ConversationChunk> chunks = new ArrayList<>();
    List<Message> current = new ArrayList<>();
    Instant chunkStart = null;
    for (Message message : sorted) {
      boolean windowExceeded =
          chunkStart != null
              && Duration.between(chunkStart, message.getTimestamp()).compareTo(timeWindow) > 0;
      if (!current.isEmpty() && (windowExceeded || current.size() >= maxChunkSize)) {
        chunks.add(buildChunk(current));
        current = new ArrayList<>();
      }
      if (current.isEmpty()) {
        chunkStart = message.getTimestamp();
      }
      current.add(message);
    }
    if (!current.isEmpty()) {
      chunks.add(buildChunk(current));
    }
    log.debug("Built {} chunks from {} messages", chunks.size(), messages.size());
    return chunks;
  }

  /** Groups messages using the configured window and size cap. */
  public List<ConversationChunk> createConversationChunks(List<Message> messages) {
    return createConversationChunks(
        messages,
        slunkConfig.getChunking().getTimeWindow(),
        slunkConfig.getChunking().getMaxChunkSize());
  }

  /** Embeds the enhanced text of a message rather than its raw content. */
  public List<Float> generateContextualEmbedding(Message message) {
    return embeddingProvider.generate(enhanceWithThreadContext(message));
  }

  /** Embeds a chunk's topic, summary, participants and first messages. */
  public List<Float> generateChunkEmbedding(ConversationChunk chunk) {
    return embeddingProvider.generate(chunkEmbeddingText(chunk));
  }

  /** The text {@link #generateChunkEmbedding} embeds. */
  public String chunkEmbeddingText(ConversationChunk chunk) {
    return "Topic: "
        + chunk.topic()
        + "\nSummary: "
        + chunk.summary()
        + "\nParticipants: "
        + String.join(", ", chunk.participants())
        + "\nKey messages: "
        + chunk.messages().stream()
            .limit(CHUNK_KEY_MESSAGES)
            .map(Message::getContent)
            .collect(Collectors.joining("; "));
  }

  private ConversationChunk buildChunk(List<Message> members) {
    Set<String> participants = new LinkedHashSet<>();
    members.forEach(m -> participants.add(m.getSender()));

    List<String> topKeywords =
        keywordExtractor.topKeywords(
            members.stream().map(Message::getContent).toList(), TOPIC_KEYWORDS);
    String topic = topKeywords.isEmpty() ? GENERAL_TOPIC : String.join(", ", topKeywords);

    Instant start = members.get(0).getTimestamp();
    Instant end = members.get(members.size() - 1).getTimestamp();
    long minutes = Duration.between(start, end).toMinutes();
    String summary =
        String.format(
            Locale.ROOT,
            "%d %s about %s with %d %s over %d %s",
            members.size(),
            members.size() == 1 ? "message" : "messages",
            topic,
            participants.size(),
            participants.size() == 1 ? "participant" : "participants",
            minutes,
            minutes == 1 ? "minute" : "minutes");

    String memberIds = members.stream().map(Message::getId).collect(Collectors.joining("\n"));
    String digest = Hashing.sha256().hashString(memberIds, StandardCharsets.UTF_8).toString();
    String id = "chunk-" + digest.substring(0, 16);

    return new ConversationChunk(
        id,
        topic,
        members,
        new ConversationChunk.TimeWindow(start, end),
        new ArrayList<>(participants),
        summary);
  }

  private String threadDescription(Message message, ThreadContext context) {
    Message parent = usableParent(message, context);
    int recentCount = slunkConfig.getContextualizer().getRecentContextMessages();
    List<Message> others =
        context.recentMessages().stream()
            .filter(m -> !m.getId().equals(message.getId()))
            .toList();
    String recent =
        others.subList(Math.max(0, others.size() - recentCount), others.size()).stream()
            .map(m -> m.getSender() + ": " + m.getContent())
            .collect(Collectors.joining("; "));

    StringBuilder text = new StringBuilder();
    text.append("Thread context: ").append(parent != null ? parent.getContent() : "").append('\n');
    if (!recent.isEmpty()) {
      text.append("Recent: ").append(recent).append('\n');
    }
    text.append("Current: ").append(message.getContent()).append('\n');
    String meaning = extractContextualMeaning(message, context);
    if (meaning != null) {
      text.append("Meaning: ").append(meaning).append('\n');
    }
    text.append("Channel: ").append(channelTopics.describe(message.getChannel()));
    return text.toString();
  }

  private String channelDescription(Message message) {
    DateTimeFormatter formatter =
        DateTimeFormatter.ofPattern(PATTERN, Locale.ENGLISH).withZone(clock.getZone());
    StringBuilder text = new StringBuilder();
    text.append("Channel: ").append(channelTopics.describe(message.getChannel())).append('\n');
    text.append("Time: ").append(formatter.format(message.getTimestamp())).append('\n');
    text.append("Sender: ").append(message.getSender()).append('\n');
    text.append("Content: ").append(message.getContent());
    Optional<ShortMessageMeaning> meaning = ShortMessageMeaning.lookup(message.getContent());
    meaning.ifPresent(m -> text.append('\n').append("Meaning: ").append(m.getGloss()));
    return text.toString();
  }

  private static boolean hasUsableContext(Message message, ThreadContext context) {
    if (context == null) {
      return false;
    }
    return usableParent(message, context) != null
        || context.recentMessages().stream().anyMatch(m -> !m.getId().equals(message.getId()));
  }

  /** The thread parent, unless the message is the parent itself. */
  private static Message usableParent(Message message, ThreadContext context) {
    if (context == null || context.parentMessage() == null) {
      return null;
    }
    Message parent = context.parentMessage();
    return parent.getId() != null && parent.getId().equals(message.getId()) ? null : parent;
  }

  private static String connector(ShortMessageMeaning.Category category) {
    return switch (category) {
      case APPROVAL, DISAPPROVAL, ACKNOWLEDGEMENT -> "in response to";
      case COMPLETION, STATUS -> "regarding";
      case ALERT -> "raised about";
      case QUESTION -> "asking about";
      case INFORMATION -> "about";
      case REACTION -> "reacting to";
    };
  }
}
