package com.feedrelay.tais.ingest;

import com.feedrelay.tais.model.TrackUpdate;
import com.feedrelay.tais.state.DirtyTracker;
import com.feedrelay.tais.state.TrackStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies forwarded TAIS messages to the track store.
 *
 * <p>This is the single ingestion entry point for every transport (Redis consumer, HTTP forward).
 * Malformed or foreign messages are counted and logged, never thrown back to the caller.
 */
@Service
public class TaisIngestService {
  private static final Logger log = LoggerFactory.getLogger(TaisIngestService.class);

  private final TaisMessageParser parser;
  private final TrackStore trackStore;
  private final DirtyTracker dirtyTracker;
  private final Counter processedCounter;
  private final Counter ignoredCounter;
  private final Counter errorCounter;
  private final Counter skippedRecordCounter;

  public TaisIngestService(
      TaisMessageParser parser,
      TrackStore trackStore,
      DirtyTracker dirtyTracker,
      MeterRegistry meterRegistry) {
    this.parser = parser;
    this.trackStore = trackStore;
    this.dirtyTracker = dirtyTracker;
    this.processedCounter = meterRegistry.counter("tais.messages.processed");
    this.ignoredCounter = meterRegistry.counter("tais.messages.ignored");
    this.errorCounter = meterRegistry.counter("tais.messages.errors");
    this.skippedRecordCounter = meterRegistry.counter("tais.records.skipped");
    meterRegistry.gauge("tais.tracks.active", trackStore, TrackStore::totalTracks);
    meterRegistry.gauge("tais.facilities.active", trackStore, TrackStore::facilityCount);
  }

  /**
   * Normalizes one message and applies its records.
   *
   * @param topic broker topic
   * @param body raw XML body
   * @return number of track records applied
   */
  public int processMessage(String topic, String body) {
    ParseResult result;
    try {
      result = parser.parse(topic, body);
    } catch (RuntimeException ex) {
      errorCounter.increment();
      log.warn("Unexpected failure parsing TAIS message on topic={}", topic, ex);
      return 0;
    }
    switch (result.status()) {
      case IGNORED_TOPIC, IGNORED_SCHEMA -> {
        ignoredCounter.increment();
        return 0;
      }
      case MALFORMED -> {
        errorCounter.increment();
        log.debug("Dropped TAIS message on topic={}: {}: {}", topic, result.errorCategory(), result.errorMessage());
        return 0;
      }
      default -> {
        return apply(result);
      }
    }
  }

  private int apply(ParseResult result) {
    String facility = result.facility();
    if (result.skippedRecords() > 0) {
      skippedRecordCounter.increment(result.skippedRecords());
    }

    int applied = 0;
    try {
      for (TrackUpdate update : result.updates()) {
        trackStore.upsert(facility, update);
        applied++;
      }
    } catch (RuntimeException ex) {
      errorCounter.increment();
      log.warn("Failed to apply TAIS records for facility {}", facility, ex);
    }

    if (applied > 0) {
      dirtyTracker.markDirty(facility);
    }
    processedCounter.increment();
    return applied;
  }
}
