package com.feedrelay.tais.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.feedrelay.tais.config.TaisProperties;
import com.feedrelay.tais.model.ForwardedMessage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Background loop consuming {@code (topic, body)} pairs the upstream bridge pushes onto Redis.
 *
 * <p>Each list entry is a JSON {@link ForwardedMessage}; its content is handed to
 * {@link TaisIngestService#processMessage}. Loop failures are counted and logged, never fatal.
 */
@Component
@ConditionalOnProperty(prefix = "tais.redis", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedisForwardConsumer {
  private static final Logger LOGGER = LoggerFactory.getLogger(RedisForwardConsumer.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final TaisIngestService ingestService;
  private final TaisProperties properties;
  private final ExecutorService executor;
  private final Counter consumedCounter;
  private final Counter errorCounter;

  public RedisForwardConsumer(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      TaisIngestService ingestService,
      TaisProperties properties,
      MeterRegistry meterRegistry) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.ingestService = ingestService;
    this.properties = properties;
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "tais-forward-consumer");
      thread.setDaemon(true);
      return thread;
    });
    this.consumedCounter = meterRegistry.counter("tais.forward.consumed");
    this.errorCounter = meterRegistry.counter("tais.forward.errors");
  }

  /** Starts the consumer loop after Spring context initialization. */
  @jakarta.annotation.PostConstruct
  public void start() {
    LOGGER.info("Consuming forwarded TAIS messages from Redis list {}", properties.getRedis().getInputKey());
    executor.submit(this::runLoop);
  }

  /** Stops the loop and waits briefly for a clean shutdown. */
  @jakarta.annotation.PreDestroy
  public void stop() {
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  private void runLoop() {
    Duration timeout = Duration.ofSeconds(properties.getRedis().getPollTimeoutSeconds());
    while (!Thread.currentThread().isInterrupted()) {
      try {
        String payload = redisTemplate.opsForList().rightPop(properties.getRedis().getInputKey(), timeout);
        if (payload != null) {
          consume(payload);
        }
      } catch (Exception ex) {
        if (isInterruptedShutdown(ex)) {
          Thread.currentThread().interrupt();
          LOGGER.debug("Forward consumer interrupted during shutdown");
          return;
        }
        errorCounter.increment();
        LOGGER.warn("Forward consumer loop error", ex);
      }
    }
  }

  void consume(String payload) {
    ForwardedMessage message;
    try {
      message = objectMapper.readValue(payload, ForwardedMessage.class);
    } catch (Exception ex) {
      errorCounter.increment();
      LOGGER.debug("Failed to parse forwarded message", ex);
      return;
    }
    if (message.topic() == null || message.body() == null) {
      errorCounter.increment();
      return;
    }
    ingestService.processMessage(message.topic(), message.body());
    consumedCounter.increment();
  }

  private static boolean isInterruptedShutdown(Throwable ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof InterruptedException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
