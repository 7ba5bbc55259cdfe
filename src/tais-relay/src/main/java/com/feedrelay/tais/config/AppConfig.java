package com.feedrelay.tais.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  // Single time source for lastSeen, ageSec and the staleness cutoff.
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
