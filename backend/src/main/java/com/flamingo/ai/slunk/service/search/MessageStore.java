package com.flamingo.ai.slunk.service.search;

import com.flamingo.ai.slunk.elasticsearch.MessageDocument;
import com.flamingo.ai.slunk.service.query.DateRange;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Vector, keyword and time primitives over indexed messages and chunks.
 *
 * <p>All query methods apply the hard filters in {@link SearchFilters}. Failures surface as
 * {@link com.flamingo.ai.slunk.exception.StoreUnavailableException}.
 */
public interface MessageStore {

  /** Inserts or replaces a document by id. */
  void upsert(MessageDocument document);

  /** Inserts or replaces documents in one round trip. */
  void upsertAll(List<MessageDocument> documents);

  /** Nearest neighbours by embedding. */
  List<VectorMatch> queryByVector(List<Float> vector, int topK, SearchFilters filters);

  /** Documents whose content or keywords match any of the keywords. */
  List<MessageDocument> queryByKeywords(
      Collection<String> keywords, int limit, SearchFilters filters);

  /** Documents with a timestamp inside the range, newest first. */
  List<MessageDocument> queryByTimeRange(DateRange range, int limit, SearchFilters filters);

  Optional<MessageDocument> get(String id);

  /** Every document matching the filters, newest first, capped at {@code limit}. */
  List<MessageDocument> getAll(int limit, SearchFilters filters);

  long count();
}
