package com.feedrelay.tais;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot entrypoint for the TAIS relay service.
 *
 * <p>The relay consumes forwarded TAIS track-and-flight-plan messages, keeps live per-facility
 * track state in memory, and streams snapshot-then-batch updates to subscribed clients.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TaisRelayApplication {
  /**
   * Starts the relay application.
   *
   * @param args CLI arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(TaisRelayApplication.class, args);
  }

  // Broadcast and purge timers; tests turn them off to drive cycles by hand.
  @Configuration(proxyBeanMethods = false)
  @EnableScheduling
  @ConditionalOnProperty(
      prefix = "tais.scheduling",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  static class SchedulingConfiguration {}
}
