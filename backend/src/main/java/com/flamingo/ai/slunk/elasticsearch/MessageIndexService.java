package com.flamingo.ai.slunk.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.GetResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.slunk.domain.enums.DocumentKind;
import com.flamingo.ai.slunk.exception.StoreUnavailableException;
import com.flamingo.ai.slunk.service.query.DateRange;
import com.flamingo.ai.slunk.service.search.MessageStore;
import com.flamingo.ai.slunk.service.search.SearchFilters;
import com.flamingo.ai.slunk.service.search.VectorMatch;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch-backed {@link MessageStore}.
 *
 * <p>Messages and conversation chunks share one index, told apart by {@code kind}. Embeddings
 * use a cosine {@code dense_vector}; channel and sender filters run against lower-cased keyword
 * copies of those fields.
 */
@Service
@Slf4j
public class MessageIndexService implements MessageStore {

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;
  private final int vectorDimensions;

  public MessageIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      @Value("${app.elasticsearch.message-index-name:slunk-messages}") String indexName,
      @Value("${app.elasticsearch.vector-dimensions:384}") int vectorDimensions) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn("Elasticsearch client not available, skipping message index initialization");
        return;
      }
      boolean exists = indices.exists(e -> e.index(indexName)).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch message index: {}", indexName);
      }
    } catch (Exception e) {
      log.warn("Could not check/create Elasticsearch message index: {}", e.getMessage());
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = new HashMap<>();
    properties.put("kind", Property.of(p -> p.keyword(k -> k)));
    properties.put("channel", Property.of(p -> p.keyword(k -> k)));
    properties.put("channelKey", Property.of(p -> p.keyword(k -> k)));
    properties.put("sender", Property.of(p -> p.keyword(k -> k)));
    properties.put("senderKey", Property.of(p -> p.keyword(k -> k)));
    properties.put("threadId", Property.of(p -> p.keyword(k -> k)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("enhancedText", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("keywords", Property.of(p -> p.keyword(k -> k)));
    properties.put("timestamp", Property.of(p -> p.long_(l -> l)));
    properties.put("reactions", Property.of(p -> p.object(o -> o.enabled(false))));
    properties.put("version", Property.of(p -> p.integer(i -> i)));
    properties.put("memberIds", Property.of(p -> p.keyword(k -> k)));
    properties.put("participants", Property.of(p -> p.keyword(k -> k)));
    properties.put("participantKeys", Property.of(p -> p.keyword(k -> k)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d -> d.dims(vectorDimensions).index(true).similarity(DenseVectorSimilarity.Cosine)))));

    CreateIndexRequest createIndexRequest =
        CreateIndexRequest.of(
            c ->
                c.index(indexName)
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));

    elasticsearchClient.indices().create(createIndexRequest);
  }

  @Override
  @Timed(value = "message_index.upsert", description = "Time to upsert a message document")
  @Retry(name = "store")
  @CircuitBreaker(name = "elasticsearch")
  public void upsert(MessageDocument document) {
    try {
      Map<String, Object> source = convertToElasticsearchDoc(document);
      elasticsearchClient.index(i -> i.index(indexName).id(document.getId()).document(source));
      meterRegistry.counter("message_index.indexed", "kind", document.getKind().name()).increment();
      log.debug("Indexed {} document {}", document.getKind(), document.getId());
    } catch (Exception e) {
      log.error("Failed to index document {}: {}", document.getId(), e.getMessage());
      throw new StoreUnavailableException("Failed to index document " + document.getId(), e);
    }
  }

  @Override
  @Timed(value = "message_index.bulk_upsert", description = "Time to bulk upsert documents")
  @Retry(name = "store")
  @CircuitBreaker(name = "elasticsearch")
  public void upsertAll(List<MessageDocument> documents) {
    if (documents.isEmpty()) {
      return;
    }

    BulkResponse response;
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (MessageDocument document : documents) {
        bulkBuilder.operations(
            op ->
                op.index(
                    idx ->
                        idx.index(indexName)
                            .id(document.getId())
                            .document(convertToElasticsearchDoc(document))));
      }
      response = elasticsearchClient.bulk(bulkBuilder.build());
    } catch (Exception e) {
      log.error("Bulk indexing of {} documents failed: {}", documents.size(), e.getMessage());
      throw new StoreUnavailableException("Bulk indexing failed", e);
    }

    if (response.errors()) {
      String reason =
          response.items().stream()
              .filter(item -> item.error() != null)
              .map(BulkResponseItem::error)
              .map(error -> error.reason())
              .findFirst()
              .orElse("unknown");
      throw new StoreUnavailableException(
          "Some documents failed to index: " + reason, new IllegalStateException(reason));
    }
    meterRegistry.counter("message_index.indexed", "kind", "bulk").increment(documents.size());
    log.debug("Bulk indexed {} documents", documents.size());
  }

  @Override
  @Timed(value = "message_index.vector_search", description = "Time to vector search messages")
  @CircuitBreaker(name = "elasticsearch")
  public List<VectorMatch> queryByVector(List<Float> vector, int topK, SearchFilters filters) {
    List<Query> filterQueries = buildFilters(filters);
    try {
      SearchRequest searchRequest =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .knn(
                          k ->
                              k.field("embedding")
                                  .queryVector(vector)
                                  .k(topK)
                                  .numCandidates(Math.max(topK * 2, 50))
                                  .filter(filterQueries))
                      .size(topK));

      SearchResponse<Map> response = elasticsearchClient.search(searchRequest, Map.class);
      List<VectorMatch> results = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        double score = hit.score() != null ? hit.score() : 0.0;
        // cosine similarity is served as (1 + cos) / 2
        double distance = Math.max(0.0, Math.min(2.0, 2.0 - 2.0 * score));
        results.add(new VectorMatch(convertFromElasticsearchDoc(hit.source()), distance));
      }
      meterRegistry.counter("message_index.vector_search").increment();
      return results;
    } catch (Exception e) {
      log.error("Vector search failed: {}", e.getMessage());
      throw new StoreUnavailableException("Vector search failed", e);
    }
  }

  @Override
  @Timed(value = "message_index.keyword_search", description = "Time to keyword search messages")
  @CircuitBreaker(name = "elasticsearch")
  public List<MessageDocument> queryByKeywords(
      Collection<String> keywords, int limit, SearchFilters filters) {
    if (keywords.isEmpty()) {
      return List.of();
    }
    String text = String.join(" ", keywords);
    List<FieldValue> terms =
        keywords.stream().map(k -> FieldValue.of(k.toLowerCase(Locale.ROOT))).toList();
    List<Query> filterQueries = buildFilters(filters);
    Query contentMatch = Query.of(q -> q.match(m -> m.field("content").query(text)));
    Query enhancedMatch = Query.of(q -> q.match(m -> m.field("enhancedText").query(text)));
    Query keywordTerms =
        Query.of(q -> q.terms(t -> t.field("keywords").terms(v -> v.value(terms))));
    try {
      SearchRequest searchRequest =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .size(limit)
                      .query(
                          q ->
                              q.bool(
                                  b ->
                                      b.filter(filterQueries)
                                          .should(contentMatch, enhancedMatch, keywordTerms)
                                          .minimumShouldMatch("1"))));

      List<MessageDocument> results = executeSearch(searchRequest);
      meterRegistry.counter("message_index.keyword_search").increment();
      return results;
    } catch (Exception e) {
      log.error("Keyword search failed: {}", e.getMessage());
      throw new StoreUnavailableException("Keyword search failed", e);
    }
  }

  @Override
  @Timed(value = "message_index.time_search", description = "Time to query messages by time")
  @CircuitBreaker(name = "elasticsearch")
  public List<MessageDocument> queryByTimeRange(DateRange range, int limit, SearchFilters filters) {
    List<Query> filterQueries = new ArrayList<>(buildFilters(filters));
    filterQueries.add(timeRangeQuery(range));
    try {
      SearchRequest searchRequest =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .size(limit)
                      .query(q -> q.bool(b -> b.filter(filterQueries)))
                      .sort(so -> so.field(f -> f.field("timestamp").order(SortOrder.Desc))));
      return executeSearch(searchRequest);
    } catch (Exception e) {
      log.error("Time range search failed: {}", e.getMessage());
      throw new StoreUnavailableException("Time range search failed", e);
    }
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public Optional<MessageDocument> get(String id) {
    try {
      GetResponse<Map> response =
          elasticsearchClient.get(g -> g.index(indexName).id(id), Map.class);
      if (!response.found() || response.source() == null) {
        return Optional.empty();
      }
      return Optional.of(convertFromElasticsearchDoc(response.source()));
    } catch (Exception e) {
      log.error("Failed to fetch document {}: {}", id, e.getMessage());
      throw new StoreUnavailableException("Failed to fetch document " + id, e);
    }
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public List<MessageDocument> getAll(int limit, SearchFilters filters) {
    List<Query> filterQueries = buildFilters(filters);
    try {
      SearchRequest searchRequest =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .size(limit)
                      .query(q -> q.bool(b -> b.filter(filterQueries)))
                      .sort(so -> so.field(f -> f.field("timestamp").order(SortOrder.Desc))));
      return executeSearch(searchRequest);
    } catch (Exception e) {
      log.error("Listing documents failed: {}", e.getMessage());
      throw new StoreUnavailableException("Listing documents failed", e);
    }
  }

  @Override
  public long count() {
    try {
      return elasticsearchClient.count(c -> c.index(indexName)).count();
    } catch (Exception e) {
      log.warn("Failed to count documents in {}: {}", indexName, e.getMessage());
      throw new StoreUnavailableException("Failed to count documents", e);
    }
  }

  /** Refreshes the index so recent writes become searchable. */
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(indexName));
    } catch (Exception e) {
      log.warn("Failed to refresh message index: {}", e.getMessage());
    }
  }

  public String getIndexName() {
    return indexName;
  }

  private List<MessageDocument> executeSearch(SearchRequest searchRequest) throws IOException {
    SearchResponse<Map> response = elasticsearchClient.search(searchRequest, Map.class);
    List<MessageDocument> results = new ArrayList<>();
    for (Hit<Map> hit : response.hits().hits()) {
      if (hit.source() != null) {
        results.add(convertFromElasticsearchDoc(hit.source()));
      }
    }
    return results;
  }

  private List<Query> buildFilters(SearchFilters filters) {
    List<Query> queries = new ArrayList<>();
    if (!filters.includeChunks()) {
      queries.add(
          Query.of(q -> q.term(t -> t.field("kind").value(DocumentKind.MESSAGE.name()))));
    }
    if (!filters.channels().isEmpty()) {
      queries.add(termsQuery("channelKey", filters.channels()));
    }
    if (!filters.users().isEmpty()) {
      queries.add(
          Query.of(
              q ->
                  q.bool(
                      b ->
                          b.should(termsQuery("senderKey", filters.users()))
                              .should(termsQuery("participantKeys", filters.users()))
                              .minimumShouldMatch("1"))));
    }
    if (filters.dateRange() != null) {
      queries.add(timeRangeQuery(filters.dateRange()));
    }
    return queries;
  }

  private static Query termsQuery(String field, Set<String> values) {
    List<FieldValue> fieldValues = values.stream().map(FieldValue::of).toList();
    return Query.of(q -> q.terms(t -> t.field(field).terms(v -> v.value(fieldValues))));
  }

  private static Query timeRangeQuery(DateRange range) {
    double start = range.start().toEpochMilli();
    double end = range.end().toEpochMilli();
    return Query.of(q -> q.range(r -> r.number(n -> n.field("timestamp").gte(start).lt(end))));
  }

  private Map<String, Object> convertToElasticsearchDoc(MessageDocument document) {
    Map<String, Object> doc = new HashMap<>();
    doc.put("id", document.getId());
    doc.put("kind", document.getKind().name());
    doc.put("channel", document.getChannel());
    doc.put("channelKey", lower(document.getChannel()));
    doc.put("sender", document.getSender());
    doc.put("senderKey", lower(document.getSender()));
    doc.put("threadId", document.getThreadId());
    doc.put("content", document.getContent());
    doc.put("enhancedText", document.getEnhancedText());
    doc.put("keywords", document.getKeywords());
    doc.put("version", document.getVersion());
    doc.put("memberIds", document.getMemberIds());
    doc.put("participants", document.getParticipants());
    doc.put(
        "participantKeys",
        document.getParticipants() == null
            ? List.of()
            : document.getParticipants().stream().map(MessageIndexService::lower).toList());
    if (document.getEmbedding() != null) {
      doc.put("embedding", document.getEmbedding());
    }
    if (document.getTimestamp() != null) {
      doc.put("timestamp", document.getTimestamp().toEpochMilli());
    }
    if (document.getReactions() != null) {
      doc.put("reactions", new LinkedHashMap<>(document.getReactions()));
    }
    return doc;
  }

  @SuppressWarnings("unchecked")
  private MessageDocument convertFromElasticsearchDoc(Map<String, Object> source) {
    return MessageDocument.builder()
        .id((String) source.get("id"))
        .kind(
            source.get("kind") != null
                ? DocumentKind.valueOf((String) source.get("kind"))
                : DocumentKind.MESSAGE)
        .channel((String) source.get("channel"))
        .sender((String) source.get("sender"))
        .threadId((String) source.get("threadId"))
        .content((String) source.get("content"))
        .enhancedText((String) source.get("enhancedText"))
        .keywords(stringList(source.get("keywords")))
        .embedding(floatList(source.get("embedding")))
        .timestamp(
            source.get("timestamp") != null
                ? Instant.ofEpochMilli(((Number) source.get("timestamp")).longValue())
                : null)
        .reactions(reactions(source.get("reactions")))
        .version(source.get("version") != null ? ((Number) source.get("version")).intValue() : 1)
        .memberIds(stringList(source.get("memberIds")))
        .participants(stringList(source.get("participants")))
        .build();
  }

  @SuppressWarnings("unchecked")
  private static List<String> stringList(Object value) {
    return value instanceof List<?> list ? new ArrayList<>((List<String>) list) : new ArrayList<>();
  }

  private static List<Float> floatList(Object value) {
    if (!(value instanceof List<?> list)) {
      return null;
    }
    List<Float> floats = new ArrayList<>(list.size());
    for (Object element : list) {
      floats.add(((Number) element).floatValue());
    }
    return floats;
  }

  private static Map<String, Integer> reactions(Object value) {
    if (!(value instanceof Map<?, ?> map)) {
      return null;
    }
    Map<String, Integer> reactions = new LinkedHashMap<>();
    map.forEach((emoji, count) -> reactions.put((String) emoji, ((Number) count).intValue()));
    return reactions;
  }

  private static String lower(String value) {
    return value == null ? null : value.toLowerCase(Locale.ROOT);
  }
}
