package com.flamingo.ai.slunk.service.dedup;

import com.flamingo.ai.slunk.config.SlunkConfig;
import com.flamingo.ai.slunk.domain.entity.Message;
import com.flamingo.ai.slunk.domain.repository.MessageRepository;
import com.flamingo.ai.slunk.exception.OutOfOrderMessageException;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import org.springframework.stereotype.Component;

/**
 * Rejects new messages that arrive older than the latest accepted message of their scope.
 *
 * <p>A scope is a thread for replies and the channel for top-level messages. Watermarks are seeded
 * from the stored messages on first use.
 */
@Component
public class MessageOrderingGuard {

  private static final long MAX_TRACKED_SCOPES = 50_000;

  private final MessageRepository messageRepository;
  private final SlunkConfig slunkConfig;
  private final Cache<String, Instant> watermarks =
      CacheBuilder.newBuilder().maximumSize(MAX_TRACKED_SCOPES).build();

  public MessageOrderingGuard(MessageRepository messageRepository, SlunkConfig slunkConfig) {
    this.messageRepository = messageRepository;
    this.slunkConfig = slunkConfig;
  }

  /**
   * Checks a message that is about to be stored for the first time.
   *
   * @throws OutOfOrderMessageException when the message predates its scope's watermark
   */
  public void check(Message message) {
    if (!slunkConfig.getIngestion().isEnforceOrdering()) {
      return;
    }
    String scope = scopeOf(message);
    Instant watermark;
    try {
      watermark = watermarks.get(scope, () -> seed(message));
    } catch (ExecutionException e) {
      throw new IllegalStateException("Could not load ordering watermark for " + scope, e);
    }
    if (message.getTimestamp().isBefore(watermark)) {
      throw new OutOfOrderMessageException(scope, message.getTimestamp(), watermark);
    }
  }

  /** Records an accepted message. */
  public void advance(Message message) {
    watermarks
        .asMap()
        .merge(scopeOf(message), message.getTimestamp(), (a, b) -> a.isAfter(b) ? a : b);
  }

  static String scopeOf(Message message) {
    return message.isInThread()
        ? message.getChannel() + "/" + message.getThreadId()
        : message.getChannel();
  }

  private Instant seed(Message message) {
    Optional<Message> latest =
        message.isInThread()
            ? messageRepository.findFirstByThreadIdOrderByTimestampDesc(message.getThreadId())
            : messageRepository.findFirstByChannelAndThreadIdIsNullOrderByTimestampDesc(
                message.getChannel());
    return latest.map(Message::getTimestamp).orElse(Instant.MIN);
  }
}
