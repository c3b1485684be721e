package com.flamingo.ai.slunk.domain.repository;

import com.flamingo.ai.slunk.domain.entity.Message;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/** Repository for Message entities. */
@Repository
public interface MessageRepository extends JpaRepository<Message, String> {

  /** Finds all messages of a thread in conversation order. */
  List<Message> findByThreadIdOrderByTimestampAscIdAsc(String threadId);

  /** Latest reply of a thread. */
  Optional<Message> findFirstByThreadIdOrderByTimestampDesc(String threadId);

  /** Latest top-level message of a channel. */
  Optional<Message> findFirstByChannelAndThreadIdIsNullOrderByTimestampDesc(String channel);

  long countByIndexedTrue();

  /** Counts distinct non-null thread ids. */
  @Query("SELECT COUNT(DISTINCT m.threadId) FROM Message m WHERE m.threadId IS NOT NULL")
  long countDistinctThreads();
}
