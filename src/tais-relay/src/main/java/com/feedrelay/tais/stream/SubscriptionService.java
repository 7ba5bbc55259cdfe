package com.feedrelay.tais.stream;

import com.feedrelay.tais.model.StreamEnvelope;
import com.feedrelay.tais.query.TrackQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Subscribe/unsubscribe entry point for stream clients.
 *
 * <p>A new subscriber receives one {@code snapshot} envelope before {@link #subscribe} returns;
 * later state reaches it through batch and remove envelopes.
 */
@Service
public class SubscriptionService {
  private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

  private final ClientRegistry registry;
  private final TrackQueryService queryService;
  private final StreamEnvelopeWriter writer;

  public SubscriptionService(
      ClientRegistry registry,
      TrackQueryService queryService,
      StreamEnvelopeWriter writer,
      MeterRegistry meterRegistry) {
    this.registry = registry;
    this.queryService = queryService;
    this.writer = writer;
    meterRegistry.gauge("tais.clients.active", registry, ClientRegistry::clientCount);
  }

  /**
   * Registers a client and sends it the facility's current snapshot.
   *
   * @param facility facility code, need not have tracks yet
   * @param client transport-backed client
   * @return generated client id used to unsubscribe
   */
  public String subscribe(String facility, RelayClient client) {
    String clientId = registry.register(facility, client);
    byte[] snapshot = writer.write(StreamEnvelope.snapshot(queryService.snapshot(facility).tracks()));
    if (!client.enqueue(snapshot)) {
      log.debug("Snapshot not queued for client {} on facility {}", clientId, facility);
    }
    log.debug("Client {} subscribed to facility {}", clientId, facility);
    return clientId;
  }

  public void unsubscribe(String facility, String clientId) {
    if (registry.unregister(facility, clientId)) {
      log.debug("Client {} unsubscribed from facility {}", clientId, facility);
    }
  }
}
