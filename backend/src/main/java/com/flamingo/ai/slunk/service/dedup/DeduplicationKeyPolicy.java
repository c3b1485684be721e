package com.flamingo.ai.slunk.service.dedup;

import com.flamingo.ai.slunk.domain.entity.Message;
import com.google.common.base.Strings;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Derives the identity of an incoming message.
 *
 * <p>The dedup key never includes the content, so an edit of a message maps to the same key and
 * is detected as an update. When the source supplies its own message id the key is
 * {@code workspace:channel:id:<id>}; otherwise the sender and the millisecond timestamp identify
 * the message within its channel.
 */
@Component
public class DeduplicationKeyPolicy {

  static final String DEFAULT_WORKSPACE = "default";

  public String dedupKey(Message message) {
    String workspace =
        Strings.isNullOrEmpty(message.getWorkspace()) ? DEFAULT_WORKSPACE : message.getWorkspace();
    String prefix = workspace + ":" + message.getChannel() + ":";
    if (!Strings.isNullOrEmpty(message.getId())) {
      return prefix + "id:" + message.getId();
    }
    return prefix + message.getSender() + ":" + message.getTimestamp().toEpochMilli();
  }

  /** The stored id: the source id when given, else a name-based UUID of the dedup key. */
  public String messageId(Message message, String dedupKey) {
    if (!Strings.isNullOrEmpty(message.getId())) {
      return message.getId();
    }
    return UUID.nameUUIDFromBytes(dedupKey.getBytes(StandardCharsets.UTF_8)).toString();
  }

  /** SHA-256 over content, sender and timestamp, NUL separated. */
  public String contentHash(Message message) {
    String material =
        message.getContent()
            + '\0'
            + message.getSender()
            + '\0'
            + message.getTimestamp().toEpochMilli();
    return Hashing.sha256().hashString(material, StandardCharsets.UTF_8).toString();
  }

  /** Fills in dedup key, id and content hash on an incoming message. */
  public Message assignIdentity(Message message) {
    String key = dedupKey(message);
    message.setDedupKey(key);
    message.setId(messageId(message, key));
    message.setContentHash(contentHash(message));
    return message;
  }
}
