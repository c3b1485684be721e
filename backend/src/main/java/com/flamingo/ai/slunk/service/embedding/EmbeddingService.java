package com.flamingo.ai.slunk.service.embedding;

import com.flamingo.ai.slunk.config.SlunkConfig;
import com.flamingo.ai.slunk.exception.EmbeddingGenerationException;
import com.flamingo.ai.slunk.exception.QueryTimeoutException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * {@link EmbeddingProvider} backed by a LangChain4j {@link EmbeddingModel}.
 *
 * <p>Each model call runs on the embedding pool under the configured deadline. Transient model
 * errors are retried; blank input and timeouts are not.
 */
@Service
@Slf4j
public class EmbeddingService implements EmbeddingProvider {

  private final EmbeddingModel embeddingModel;
  private final ThreadPoolTaskExecutor embeddingExecutor;
  private final SlunkConfig slunkConfig;
  private final MeterRegistry meterRegistry;

  @Value("${app.elasticsearch.vector-dimensions:384}")
  private int dimensions;

  public EmbeddingService(
      EmbeddingModel embeddingModel,
      @Qualifier("embeddingExecutor") ThreadPoolTaskExecutor embeddingExecutor,
      SlunkConfig slunkConfig,
      MeterRegistry meterRegistry) {
    this.embeddingModel = embeddingModel;
    this.embeddingExecutor = embeddingExecutor;
    this.slunkConfig = slunkConfig;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @CircuitBreaker(name = "embedding")
  @Retry(name = "embedding", fallbackMethod = "generateFallback")
  public List<Float> generate(String text) {
    if (text == null || text.isBlank()) {
      throw new EmbeddingGenerationException("Cannot embed blank text");
    }
    String input = truncate(text);
    Duration timeout = slunkConfig.getEmbedding().getTimeout();
    log.debug("Generating embedding, input length: {} chars", input.length());

    Timer.Sample sample = Timer.start(meterRegistry);
    Future<Embedding> future =
        embeddingExecutor.submit(() -> embeddingModel.embed(input).content());
    try {
      Embedding embedding = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      List<Float> vector = toVector(embedding);
      meterRegistry.counter("embedding.requests.success").increment();
      return vector;
    } catch (TimeoutException e) {
      future.cancel(true);
      meterRegistry.counter("embedding.requests.timeout").increment();
      throw new QueryTimeoutException("embedding", timeout, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new QueryTimeoutException("embedding", timeout, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new IllegalStateException("Embedding model failed", cause);
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  @Override
  public int dimensions() {
    return dimensions;
  }

  @SuppressWarnings("unused")
  private List<Float> generateFallback(String text, Throwable t) {
    meterRegistry.counter("embedding.requests.failure").increment();
    if (t instanceof EmbeddingGenerationException generationException) {
      throw generationException;
    }
    if (t instanceof QueryTimeoutException timeoutException) {
      throw timeoutException;
    }
    log.error("Embedding failed after retries: {}", t.getMessage());
    throw new EmbeddingGenerationException("Embedding provider failed: " + t.getMessage(), t);
  }

  private String truncate(String text) {
    int maxChars = slunkConfig.getEmbedding().getMaxInputChars();
    if (text.length() <= maxChars) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} to {} chars", text.length(), maxChars);
    return text.substring(0, maxChars);
  }

  private List<Float> toVector(Embedding embedding) {
    float[] raw = embedding == null ? new float[0] : embedding.vector();
    if (raw.length != dimensions) {
      throw new EmbeddingGenerationException(
          "Embedding has " + raw.length + " dimensions, expected " + dimensions);
    }
    List<Float> vector = new ArrayList<>(raw.length);
    for (float value : raw) {
      if (Float.isNaN(value) || Float.isInfinite(value)) {
        throw new EmbeddingGenerationException("Embedding contains non-finite values");
      }
      vector.add(value);
    }
    return vector;
  }
}
