package com.flamingo.ai.slunk.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the LangChain4j embedding model. */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:384}")
  private int embeddingDimensions;

  /** On-device model; deterministic for identical input and needs no API key. */
  @Bean
  @ConditionalOnProperty(
      name = "slunk.embedding.provider",
      havingValue = "local",
      matchIfMissing = true)
  public EmbeddingModel localEmbeddingModel() {
    return new AllMiniLmL6V2EmbeddingModel();
  }

  @Bean
  @ConditionalOnProperty(name = "slunk.embedding.provider", havingValue = "openai")
  public EmbeddingModel openAiEmbeddingModel() {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required when slunk.embedding.provider=openai. "
              + "Set OPENAI_API_KEY environment variable.");
    }
  }
}
