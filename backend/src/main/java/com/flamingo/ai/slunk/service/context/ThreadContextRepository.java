package com.flamingo.ai.slunk.service.context;

import java.util.Optional;

/** Source of thread history. */
public interface ThreadContextRepository {

  /**
   * Builds the context of a thread.
   *
   * @param threadId the thread identifier
   * @return the context, or empty when no message of the thread is known
   */
  Optional<ThreadContext> getThread(String threadId);
}
