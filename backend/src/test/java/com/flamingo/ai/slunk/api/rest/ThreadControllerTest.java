package com.flamingo.ai.slunk.api.rest;

import static com.flamingo.ai.slunk.support.TestMessages.message;
import static com.flamingo.ai.slunk.support.TestMessages.reply;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.slunk.exception.ApiError;
import com.flamingo.ai.slunk.exception.GlobalExceptionHandler;
import com.flamingo.ai.slunk.service.context.ThreadContext;
import com.flamingo.ai.slunk.service.context.ThreadContextService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ThreadControllerTest {

  private static final Instant T0 = Instant.parse("2024-03-15T10:00:00Z");

  @Mock private ThreadContextService threadContextService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new ThreadController(threadContextService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("should return the parent and recent replies of a thread")
  void shouldReturnThread() throws Exception {
    ThreadContext context =
        new ThreadContext(
            "t1",
            message("t1", "alice", "Should we deploy?", T0),
            List.of(reply("r1", "t1", "bob", "👍", T0.plusSeconds(30))),
            2);
    when(threadContextService.getThreadContext("t1")).thenReturn(Optional.of(context));

    mockMvc
        .perform(get("/api/threads/t1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.threadId").value("t1"))
        .andExpect(jsonPath("$.parentMessage.content").value("Should we deploy?"))
        .andExpect(jsonPath("$.recentMessages[0].sender").value("bob"))
        .andExpect(jsonPath("$.totalMessageCount").value(2));
  }

  @Test
  @DisplayName("should answer 404 for an unknown thread")
  void shouldReturnNotFound() throws Exception {
    when(threadContextService.getThreadContext("missing")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/threads/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.THREAD_NOT_FOUND));
  }
}
