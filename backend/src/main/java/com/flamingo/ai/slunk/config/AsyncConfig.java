package com.flamingo.ai.slunk.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Bounded worker pools for embedding calls, batch indexing and deadline-bound searches. */
@Configuration
public class AsyncConfig {

  @Bean(name = "embeddingExecutor")
  public ThreadPoolTaskExecutor embeddingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("embed-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "ingestionExecutor")
  public ThreadPoolTaskExecutor ingestionExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("ingest-");
    // Large batches index on the caller once the queue is full.
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }

  @Bean(name = "searchExecutor")
  public ThreadPoolTaskExecutor searchExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("search-");
    executor.initialize();
    return executor;
  }
}
