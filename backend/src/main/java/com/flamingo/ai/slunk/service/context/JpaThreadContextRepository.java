package com.flamingo.ai.slunk.service.context;

import com.flamingo.ai.slunk.config.SlunkConfig;
import com.flamingo.ai.slunk.domain.entity.Message;
import com.flamingo.ai.slunk.domain.repository.MessageRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Builds thread contexts from stored messages.
 *
 * <p>The parent is the message whose id equals the thread id; when that message was never
 * captured, the earliest reply stands in for it.
 */
@Repository
@RequiredArgsConstructor
public class JpaThreadContextRepository implements ThreadContextRepository {

  private final MessageRepository messageRepository;
  private final SlunkConfig slunkConfig;

  @Override
  @Transactional(readOnly = true)
  public Optional<ThreadContext> getThread(String threadId) {
    List<Message> replies =
        new ArrayList<>(messageRepository.findByThreadIdOrderByTimestampAscIdAsc(threadId));
    Optional<Message> storedParent = messageRepository.findById(threadId);
    if (replies.isEmpty() && storedParent.isEmpty()) {
      return Optional.empty();
    }

    Message parent;
    long total = replies.size();
    if (storedParent.isPresent()) {
      parent = storedParent.get();
      boolean parentListed = replies.removeIf(m -> m.getId().equals(threadId));
      if (!parentListed) {
        total++;
      }
    } else {
      parent = replies.remove(0);
    }

    int window = slunkConfig.getThreadContext().getRecentWindow();
    List<Message> recent = replies.subList(Math.max(0, replies.size() - window), replies.size());
    return Optional.of(new ThreadContext(threadId, parent, recent, total));
  }
}
