package com.flamingo.ai.slunk.api.rest;

import com.flamingo.ai.slunk.api.dto.request.CreateChunksRequest;
import com.flamingo.ai.slunk.api.dto.request.MessageRequest;
import com.flamingo.ai.slunk.api.dto.response.ChunkResponse;
import com.flamingo.ai.slunk.domain.entity.Message;
import com.flamingo.ai.slunk.service.chunk.ConversationChunkService;
import com.flamingo.ai.slunk.service.context.ConversationChunk;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for conversation chunking. */
@RestController
@RequestMapping("/api/chunks")
@RequiredArgsConstructor
public class ChunkController {

  private final ConversationChunkService conversationChunkService;

  /** Groups inline or stored messages into conversation chunks. */
  @PostMapping
  public ResponseEntity<List<ChunkResponse>> createChunks(
      @Valid @RequestBody CreateChunksRequest request) {
    List<Message> messages;
    if (request.getMessageIds() != null && !request.getMessageIds().isEmpty()) {
      messages = conversationChunkService.loadMessages(request.getMessageIds());
    } else {
      messages = new ArrayList<>();
      int position = 0;
      for (MessageRequest messageRequest : request.getMessages()) {
        Message message = messageRequest.toMessage();
        if (message.getId() == null) {
          message.setId("inline-" + position);
        }
        messages.add(message);
        position++;
      }
    }
    Duration window =
        request.getTimeWindowSeconds() != null
            ? Duration.ofSeconds(request.getTimeWindowSeconds())
            : null;
    List<ConversationChunk> chunks =
        conversationChunkService.createChunks(
            messages, window, request.getMaxChunkSize(), request.isIndex());
    return ResponseEntity.ok(chunks.stream().map(ChunkResponse::fromChunk).toList());
  }
}
