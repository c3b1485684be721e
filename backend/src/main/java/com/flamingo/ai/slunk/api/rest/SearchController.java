package com.flamingo.ai.slunk.api.rest;

import com.flamingo.ai.slunk.api.dto.request.ParseRequest;
import com.flamingo.ai.slunk.api.dto.request.SearchRequest;
import com.flamingo.ai.slunk.api.dto.response.ConversationalSearchResponse;
import com.flamingo.ai.slunk.api.dto.response.ParsedQueryResponse;
import com.flamingo.ai.slunk.api.dto.response.SearchResultsResponse;
import com.flamingo.ai.slunk.api.dto.response.SearchSessionResponse;
import com.flamingo.ai.slunk.service.query.QueryParser;
import com.flamingo.ai.slunk.service.search.ConversationalSearchResult;
import com.flamingo.ai.slunk.service.search.ConversationalSearchService;
import com.flamingo.ai.slunk.service.search.HybridSearchService;
import com.flamingo.ai.slunk.service.search.SearchResponse;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for hybrid and conversational search. */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

  private final HybridSearchService hybridSearchService;
  private final ConversationalSearchService conversationalSearchService;
  private final QueryParser queryParser;

  /** Runs a natural-language search. */
  @PostMapping
  public ResponseEntity<SearchResultsResponse> search(@Valid @RequestBody SearchRequest request) {
    SearchResponse response =
        hybridSearchService.search(
            request.getQuery(),
            request.limitOrZero(),
            request.toFilters(),
            request.getTimeoutMillis());
    return ResponseEntity.ok(SearchResultsResponse.fromResponse(response));
  }

  /** Parses a query without running it. */
  @PostMapping("/parse")
  public ResponseEntity<ParsedQueryResponse> parse(@Valid @RequestBody ParseRequest request) {
    return ResponseEntity.ok(ParsedQueryResponse.fromQuery(queryParser.parse(request.getQuery())));
  }

  /** Starts a conversational search session. */
  @PostMapping("/sessions")
  public ResponseEntity<SearchSessionResponse> startSession() {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(SearchSessionResponse.fromSession(conversationalSearchService.startSession()));
  }

  /** Runs one turn of a conversational search session. */
  @PostMapping("/sessions/{sessionId}/query")
  public ResponseEntity<ConversationalSearchResponse> query(
      @PathVariable UUID sessionId, @Valid @RequestBody SearchRequest request) {
    ConversationalSearchResult result =
        conversationalSearchService.search(
            sessionId, request.getQuery(), request.limitOrZero(), request.toFilters());
    return ResponseEntity.ok(ConversationalSearchResponse.fromResult(result));
  }

  /** Ends a conversational search session. */
  @DeleteMapping("/sessions/{sessionId}")
  public ResponseEntity<Void> endSession(@PathVariable UUID sessionId) {
    conversationalSearchService.endSession(sessionId);
    return ResponseEntity.noContent().build();
  }
}
