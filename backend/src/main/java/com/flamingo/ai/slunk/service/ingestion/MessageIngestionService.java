package com.flamingo.ai.slunk.service.ingestion;

import com.flamingo.ai.slunk.api.dto.response.IngestionStats;
import com.flamingo.ai.slunk.domain.entity.Message;
import com.flamingo.ai.slunk.service.dedup.DeduplicationResult;
import java.util.List;

/** Service interface for capturing messages into the store and the search index. */
public interface MessageIngestionService {

  /**
   * Deduplicates, stores and indexes a single message.
   *
   * @param message the incoming message
   * @return the deduplication outcome
   * @throws com.flamingo.ai.slunk.exception.InvalidMessageException if a required field is
   *     missing
   * @throws com.flamingo.ai.slunk.exception.OutOfOrderMessageException if a new message predates
   *     its channel or thread
   */
  DeduplicationResult ingest(Message message);

  /**
   * Ingests a batch in timestamp order. Invalid or out-of-order messages are counted, not thrown.
   *
   * @param messages the incoming messages
   * @return per-outcome counts
   */
  IngestionStats ingestBatch(List<Message> messages);
}
