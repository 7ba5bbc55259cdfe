package com.feedrelay.tais.stream;

import com.feedrelay.tais.config.TaisProperties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Opens per-facility SSE streams and ties emitter lifecycle to subscriptions.
 *
 * <p>Emitter completion, timeout, error or a failed write unsubscribes the client.
 */
@Service
public class SseStreamService {
  private static final Logger log = LoggerFactory.getLogger(SseStreamService.class);

  private final SubscriptionService subscriptionService;
  private final TaisProperties properties;
  private final Executor senderExecutor;
  private final ExecutorService ownedExecutor;
  private final Set<SseRelayClient> clients = ConcurrentHashMap.newKeySet();

  @Autowired
  public SseStreamService(SubscriptionService subscriptionService, TaisProperties properties) {
    this(subscriptionService, properties, newSenderPool());
  }

  SseStreamService(SubscriptionService subscriptionService, TaisProperties properties, Executor senderExecutor) {
    this.subscriptionService = subscriptionService;
    this.properties = properties;
    this.senderExecutor = senderExecutor;
    this.ownedExecutor = senderExecutor instanceof ExecutorService service ? service : null;
  }

  // Drains per-client outbound queues; producers never write to an emitter directly.
  private static ExecutorService newSenderPool() {
    AtomicInteger sequence = new AtomicInteger();
    return Executors.newCachedThreadPool(runnable -> {
      Thread thread = new Thread(runnable, "tais-stream-sender-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  /** Stops the sender pool; open emitters are left to the servlet container. */
  @jakarta.annotation.PreDestroy
  public void stop() {
    if (ownedExecutor == null) {
      return;
    }
    ownedExecutor.shutdownNow();
    try {
      ownedExecutor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Opens a stream for one facility; the first frame is the facility snapshot.
   *
   * @param facility facility code
   * @return emitter handed back to Spring MVC
   */
  public SseEmitter openStream(String facility) {
    SseEmitter emitter = createEmitter();
    SseRelayClient client =
        new SseRelayClient(emitter, properties.getStream().getQueueCapacity(), senderExecutor);

    emitter.onCompletion(client::markClosed);
    emitter.onTimeout(client::markClosed);
    emitter.onError(ex -> client.markClosed());

    String clientId = subscriptionService.subscribe(facility, client);
    clients.add(client);
    client.onClose(() -> {
      clients.remove(client);
      subscriptionService.unsubscribe(facility, clientId);
    });
    log.debug("Opened TAIS stream {} for facility {}", clientId, facility);
    return emitter;
  }

  SseEmitter createEmitter() {
    return new SseEmitter(properties.getStream().getTimeoutMs());
  }

  /** Flags a keepalive on every open client; the sender pool writes it. */
  @Scheduled(
      fixedDelayString = "${tais.stream.heartbeat-interval-ms:15000}",
      initialDelayString = "${tais.stream.heartbeat-interval-ms:15000}")
  public void heartbeat() {
    for (SseRelayClient client : clients) {
      client.heartbeat();
    }
  }

  int openClients() {
    return clients.size();
  }
}
