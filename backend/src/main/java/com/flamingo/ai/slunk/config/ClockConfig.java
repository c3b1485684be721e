package com.flamingo.ai.slunk.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Provides the clock used for temporal hint resolution and edit timestamps. */
@Configuration
public class ClockConfig {

  @Bean
  public Clock clock(SlunkConfig slunkConfig) {
    return Clock.system(ZoneId.of(slunkConfig.getQuery().getZoneId()));
  }
}
