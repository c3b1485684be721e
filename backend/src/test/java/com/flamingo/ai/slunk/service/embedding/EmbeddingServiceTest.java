package com.flamingo.ai.slunk.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.slunk.config.SlunkConfig;
import com.flamingo.ai.slunk.exception.EmbeddingGenerationException;
import com.flamingo.ai.slunk.exception.QueryTimeoutException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;

  private SlunkConfig slunkConfig;
  private SimpleMeterRegistry meterRegistry;
  private ThreadPoolTaskExecutor embeddingExecutor;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    slunkConfig = new SlunkConfig();
    meterRegistry = new SimpleMeterRegistry();
    embeddingExecutor = new ThreadPoolTaskExecutor();
    embeddingExecutor.setCorePoolSize(1);
    embeddingExecutor.initialize();
    embeddingService =
        new EmbeddingService(embeddingModel, embeddingExecutor, slunkConfig, meterRegistry);
    ReflectionTestUtils.setField(embeddingService, "dimensions", 3);
  }

  @AfterEach
  void tearDown() {
    embeddingExecutor.shutdown();
  }

  @Test
  @DisplayName("Should return the model vector")
  void shouldReturnModelVector() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(0.1f, 0.2f, 0.3f));

    List<Float> result = embeddingService.generate("Deploy finished");

    assertThat(result).containsExactly(0.1f, 0.2f, 0.3f);
    assertThat(embeddingService.dimensions()).isEqualTo(3);
    assertThat(meterRegistry.counter("embedding.requests.success").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should reject blank input without calling the model")
  void shouldRejectBlankInput() {
    assertThatThrownBy(() -> embeddingService.generate("  "))
        .isInstanceOf(EmbeddingGenerationException.class);
    verify(embeddingModel, never()).embed(anyString());
  }

  @Test
  @DisplayName("Should truncate long input to the configured size")
  void shouldTruncateLongInput() {
    slunkConfig.getEmbedding().setMaxInputChars(10);
    when(embeddingModel.embed("abcdefghij")).thenReturn(createResponse(1f, 0f, 0f));

    List<Float> result = embeddingService.generate("abcdefghijklmnopqrstuvwxyz");

    assertThat(result).containsExactly(1f, 0f, 0f);
  }

  @Test
  @DisplayName("Should reject vectors of the wrong size")
  void shouldRejectWrongDimensions() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(0.1f, 0.2f));

    assertThatThrownBy(() -> embeddingService.generate("Deploy finished"))
        .isInstanceOf(EmbeddingGenerationException.class)
        .hasMessageContaining("expected 3");
  }

  @Test
  @DisplayName("Should reject vectors with non-finite values")
  void shouldRejectNonFiniteValues() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(0.1f, Float.NaN, 0.3f));

    assertThatThrownBy(() -> embeddingService.generate("Deploy finished"))
        .isInstanceOf(EmbeddingGenerationException.class);
  }

  @Test
  @DisplayName("Should time out a slow model")
  void shouldTimeOutSlowModel() {
    slunkConfig.getEmbedding().setTimeout(Duration.ofMillis(50));
    when(embeddingModel.embed(anyString()))
        .thenAnswer(
            inv -> {
              Thread.sleep(2_000);
              return createResponse(0.1f, 0.2f, 0.3f);
            });

    assertThatThrownBy(() -> embeddingService.generate("Deploy finished"))
        .isInstanceOf(QueryTimeoutException.class)
        .hasMessageContaining("embedding timed out");
    assertThat(meterRegistry.counter("embedding.requests.timeout").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should surface model errors unchanged")
  void shouldPropagateModelErrors() {
    when(embeddingModel.embed(anyString())).thenThrow(new IllegalStateException("model offline"));

    assertThatThrownBy(() -> embeddingService.generate("Deploy finished"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("model offline");
  }

  private static Response<Embedding> createResponse(float... vector) {
    return Response.from(Embedding.from(vector));
  }
}
