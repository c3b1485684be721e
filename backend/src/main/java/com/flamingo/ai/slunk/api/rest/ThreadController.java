package com.flamingo.ai.slunk.api.rest;

import com.flamingo.ai.slunk.api.dto.response.ThreadContextResponse;
import com.flamingo.ai.slunk.exception.ThreadNotFoundException;
import com.flamingo.ai.slunk.service.context.ThreadContext;
import com.flamingo.ai.slunk.service.context.ThreadContextService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for thread lookups. */
@RestController
@RequestMapping("/api/threads")
@RequiredArgsConstructor
public class ThreadController {

  private final ThreadContextService threadContextService;

  /** Gets the parent, recent replies and size of a thread. */
  @GetMapping("/{threadId}")
  public ResponseEntity<ThreadContextResponse> getThreadContext(@PathVariable String threadId) {
    ThreadContext context =
        threadContextService
            .getThreadContext(threadId)
            .orElseThrow(() -> new ThreadNotFoundException(threadId));
    return ResponseEntity.ok(ThreadContextResponse.fromContext(context));
  }
}
