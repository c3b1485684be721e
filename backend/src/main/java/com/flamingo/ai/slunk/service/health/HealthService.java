package com.flamingo.ai.slunk.service.health;

import com.flamingo.ai.slunk.api.dto.response.SystemStats;

/** Service interface for health checks and system statistics. */
public interface HealthService {

  /**
   * Gets system-wide statistics: stored messages, threads, deduplication records and index size.
   *
   * @return system statistics
   */
  SystemStats getSystemStats();
}
