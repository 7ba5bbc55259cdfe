package com.feedrelay.tais.stream;

import com.feedrelay.tais.model.StreamEnvelope;
import com.feedrelay.tais.model.TaisTrack;
import com.feedrelay.tais.model.TrackView;
import com.feedrelay.tais.state.DirtyTracker;
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
 * Periodic batch publisher.
 *
 * <p>Each cycle drains the dirty facilities and sends one {@code batch} envelope holding the
 * facility's full track list to every open client. Facilities without clients or tracks are
 * dropped from the cycle and not re-marked.
 */
@Component
public class TrackBroadcaster {
  private static final Logger log = LoggerFactory.getLogger(TrackBroadcaster.class);

  private final TrackStore trackStore;
  private final DirtyTracker dirtyTracker;
  private final ClientRegistry registry;
  private final StreamEnvelopeWriter writer;
  private final Clock clock;
  private final Counter batchCounter;
  private final Counter skippedClientCounter;

  public TrackBroadcaster(
      TrackStore trackStore,
      DirtyTracker dirtyTracker,
      ClientRegistry registry,
      StreamEnvelopeWriter writer,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.trackStore = trackStore;
    this.dirtyTracker = dirtyTracker;
    this.registry = registry;
    this.writer = writer;
    this.clock = clock;
    this.batchCounter = meterRegistry.counter("tais.broadcast.batches");
    this.skippedClientCounter = meterRegistry.counter("tais.broadcast.skipped_clients");
  }

  @Scheduled(
      fixedDelayString = "${tais.broadcast.interval-ms:1000}",
      initialDelayString = "${tais.broadcast.interval-ms:1000}")
  public void scheduledFlush() {
    try {
      flushDirty();
    } catch (Exception ex) {
      // Keep the scheduler running even if a cycle fails.
      log.warn("Batch broadcast cycle failed", ex);
    }
  }

  /**
   * Runs one broadcast cycle.
   *
   * @return number of facilities a batch was sent for
   */
  public int flushDirty() {
    int sent = 0;
    for (String facility : dirtyTracker.drainDirty()) {
      List<RelayClient> clients = registry.clients(facility);
      if (clients.isEmpty()) {
        continue;
      }
      List<TaisTrack> tracks = trackStore.listTracks(facility);
      if (tracks.isEmpty()) {
        continue;
      }

      Instant now = clock.instant();
      List<TrackView> views = tracks.stream().map(track -> track.toView(now)).toList();
      byte[] json = writer.write(StreamEnvelope.batch(views));
      for (RelayClient client : clients) {
        if (!client.isOpen() || !client.enqueue(json)) {
          skippedClientCounter.increment();
        }
      }
      batchCounter.increment();
      sent++;
    }
    if (sent > 0) {
      log.trace("Broadcast batches for {} facilities", sent);
    }
    return sent;
  }
}
