package com.flamingo.ai.slunk.api.rest;

import com.flamingo.ai.slunk.api.dto.request.BatchIngestRequest;
import com.flamingo.ai.slunk.api.dto.request.MessageRequest;
import com.flamingo.ai.slunk.api.dto.response.ContextualMeaningResponse;
import com.flamingo.ai.slunk.api.dto.response.IngestResponse;
import com.flamingo.ai.slunk.api.dto.response.IngestionStats;
import com.flamingo.ai.slunk.domain.enums.DeduplicationOutcome;
import com.flamingo.ai.slunk.service.context.MessageContextualizer;
import com.flamingo.ai.slunk.service.dedup.DeduplicationResult;
import com.flamingo.ai.slunk.service.ingestion.MessageIngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for message ingestion and per-message lookups. */
@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
public class MessageController {

  private final MessageIngestionService messageIngestionService;
  private final MessageContextualizer messageContextualizer;

  /** Ingests one message. Answers 201 for a new message and 200 otherwise. */
  @PostMapping
  public ResponseEntity<IngestResponse> ingest(@Valid @RequestBody MessageRequest request) {
    DeduplicationResult result = messageIngestionService.ingest(request.toMessage());
    HttpStatus status =
        result.outcome() == DeduplicationOutcome.NEW ? HttpStatus.CREATED : HttpStatus.OK;
    return ResponseEntity.status(status).body(IngestResponse.fromResult(result));
  }

  /** Ingests a batch of messages in timestamp order. */
  @PostMapping("/batch")
  public ResponseEntity<IngestionStats> ingestBatch(
      @Valid @RequestBody BatchIngestRequest request) {
    IngestionStats stats =
        messageIngestionService.ingestBatch(
            request.getMessages().stream().map(MessageRequest::toMessage).toList());
    return ResponseEntity.ok(stats);
  }

  /** Gets the contextual meaning of a short message. */
  @GetMapping("/{messageId}/contextual-meaning")
  public ResponseEntity<ContextualMeaningResponse> getContextualMeaning(
      @PathVariable String messageId) {
    String meaning = messageContextualizer.getContextualMeaning(messageId).orElse(null);
    return ResponseEntity.ok(
        ContextualMeaningResponse.builder().messageId(messageId).meaning(meaning).build());
  }
}
