package com.feedrelay.tais.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the TAIS relay service.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code tais.*} prefix. Timer cadences ({@code tais.broadcast.interval-ms},
 * {@code tais.purge.interval-ms}, {@code tais.stream.heartbeat-interval-ms}) and the
 * {@code tais.redis.enabled} / {@code tais.scheduling.enabled} switches are read straight from the
 * environment by {@code @Scheduled} and {@code @ConditionalOnProperty}.
 */
@ConfigurationProperties(prefix = "tais")
public class TaisProperties {
  private final Purge purge = new Purge();
  private final Stream stream = new Stream();
  private final Redis redis = new Redis();
  private String topicPrefix = "TAIS/";
  private String rootElement = "TATrackAndFlightPlan";

  public Purge getPurge() {
    return purge;
  }

  public Stream getStream() {
    return stream;
  }

  public Redis getRedis() {
    return redis;
  }

  public String getTopicPrefix() {
    return topicPrefix;
  }

  public void setTopicPrefix(String topicPrefix) {
    this.topicPrefix = topicPrefix;
  }

  public String getRootElement() {
    return rootElement;
  }

  public void setRootElement(String rootElement) {
    this.rootElement = rootElement;
  }

  /** Idle-track eviction threshold. */
  public static class Purge {
    private Duration staleAfter = Duration.ofSeconds(60);

    public Duration getStaleAfter() {
      return staleAfter;
    }

    public void setStaleAfter(Duration staleAfter) {
      this.staleAfter = staleAfter;
    }
  }

  /** Per-client SSE transport settings. */
  public static class Stream {
    private int queueCapacity = 256;
    private long timeoutMs = 0L;

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }
  }

  /** Redis list the upstream bridge forwards {@code (topic, body)} pairs onto. */
  public static class Redis {
    private String inputKey = "feedrelay:tais:forward";
    private long pollTimeoutSeconds = 2;

    public String getInputKey() {
      return inputKey;
    }

    public void setInputKey(String inputKey) {
      this.inputKey = inputKey;
    }

    public long getPollTimeoutSeconds() {
      return pollTimeoutSeconds;
    }

    public void setPollTimeoutSeconds(long pollTimeoutSeconds) {
      this.pollTimeoutSeconds = pollTimeoutSeconds;
    }
  }
}
