package com.flamingo.ai.slunk.service.context;

import com.flamingo.ai.slunk.config.SlunkConfig;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.Striped;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owns the thread-context cache. Writers must call {@link #invalidate} after touching a thread.
 *
 * <p>Loads and invalidations of one thread hold the same lock, so a load that read the thread
 * before a write can never be cached after that write's invalidation.
 */
@Service
@Slf4j
public class ThreadContextService {

  private static final int LOCK_STRIPES = 64;

  private final ThreadContextRepository threadContextRepository;
  private final MeterRegistry meterRegistry;
  private final Cache<String, Optional<ThreadContext>> cache;
  private final Striped<Lock> locks = Striped.lock(LOCK_STRIPES);

  public ThreadContextService(
      ThreadContextRepository threadContextRepository,
      SlunkConfig slunkConfig,
      MeterRegistry meterRegistry) {
    this.threadContextRepository = threadContextRepository;
    this.meterRegistry = meterRegistry;
    this.cache =
        CacheBuilder.newBuilder()
            .maximumSize(slunkConfig.getThreadContext().getCacheSize())
            .expireAfterWrite(slunkConfig.getThreadContext().getCacheTtl())
            .build();
  }

  /**
   * Returns the context of a thread, loading it on a cache miss.
   *
   * @param threadId the thread identifier; blank yields empty
   * @return the thread context, or empty when the thread is unknown
   */
  public Optional<ThreadContext> getThreadContext(String threadId) {
    if (threadId == null || threadId.isBlank()) {
      return Optional.empty();
    }
    Optional<ThreadContext> cached = cache.getIfPresent(threadId);
    if (cached != null) {
      meterRegistry.counter("thread_context.cache", "result", "hit").increment();
      return cached;
    }
    Lock lock = locks.get(threadId);
    lock.lock();
    try {
      cached = cache.getIfPresent(threadId);
      if (cached != null) {
        meterRegistry.counter("thread_context.cache", "result", "hit").increment();
        return cached;
      }
      meterRegistry.counter("thread_context.cache", "result", "miss").increment();
      Optional<ThreadContext> loaded = threadContextRepository.getThread(threadId);
      cache.put(threadId, loaded);
      return loaded;
    } finally {
      lock.unlock();
    }
  }

  public void invalidate(String threadId) {
    if (threadId == null) {
      return;
    }
    Lock lock = locks.get(threadId);
    lock.lock();
    try {
      cache.invalidate(threadId);
    } finally {
      lock.unlock();
    }
    log.debug("Invalidated thread context cache for {}", threadId);
  }
}
