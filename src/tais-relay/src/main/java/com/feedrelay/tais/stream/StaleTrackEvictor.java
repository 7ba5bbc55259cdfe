package com.feedrelay.tais.stream;

import com.feedrelay.tais.config.TaisProperties;
import com.feedrelay.tais.model.StreamEnvelope;
import com.feedrelay.tais.model.TaisTrack;
import com.feedrelay.tais.state.TrackStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic idle-track eviction.
 *
 * <p>Removal envelopes go out immediately, outside the batch cadence, and the dirty set is left
 * untouched.
 */
@Component
public class StaleTrackEvictor {
  private static final Logger log = LoggerFactory.getLogger(StaleTrackEvictor.class);

  private final TrackStore trackStore;
  private final ClientRegistry registry;
  private final StreamEnvelopeWriter writer;
  private final Clock clock;
  private final TaisProperties properties;
  private final Counter evictedCounter;

  public StaleTrackEvictor(
      TrackStore trackStore,
      ClientRegistry registry,
      StreamEnvelopeWriter writer,
      Clock clock,
      TaisProperties properties,
      MeterRegistry meterRegistry) {
    this.trackStore = trackStore;
    this.registry = registry;
    this.writer = writer;
    this.clock = clock;
    this.properties = properties;
    this.evictedCounter = meterRegistry.counter("tais.tracks.evicted");
  }

  @Scheduled(
      fixedDelayString = "${tais.purge.interval-ms:10000}",
      initialDelayString = "${tais.purge.interval-ms:10000}")
  public void scheduledPurge() {
    try {
      purgeStaleTracks();
    } catch (Exception ex) {
      log.warn("Stale track purge failed", ex);
    }
  }

  /**
   * Evicts every track not updated within the configured threshold.
   *
   * @return number of evicted tracks
   */
  public int purgeStaleTracks() {
    Instant cutoff = clock.instant().minus(properties.getPurge().getStaleAfter());
    int total = 0;
    for (String facility : trackStore.facilities()) {
      List<TaisTrack> evicted = trackStore.evictStale(facility, cutoff);
      if (evicted.isEmpty()) {
        continue;
      }
      List<RelayClient> clients = registry.clients(facility);
      for (TaisTrack track : evicted) {
        if (clients.isEmpty()) {
          break;
        }
        byte[] json = writer.write(StreamEnvelope.remove(facility, track.trackNum()));
        for (RelayClient client : clients) {
          client.enqueue(json);
        }
      }
      total += evicted.size();
      log.debug("Evicted {} stale tracks from facility {}", evicted.size(), facility);
    }
    evictedCounter.increment(total);
    return total;
  }
}
