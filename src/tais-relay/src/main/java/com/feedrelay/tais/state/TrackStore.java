package com.feedrelay.tais.state;

import com.feedrelay.tais.model.TaisTrack;
import com.feedrelay.tais.model.TrackUpdate;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * In-memory facility → track number → track state.
 *
 * <p>Every structural change to a facility bucket (create, insert, remove, drop-when-empty) runs
 * inside {@link ConcurrentHashMap#compute} on that facility's key, so ingestion cannot write into a
 * bucket the evictor is dropping. Readers iterate the per-facility maps without locking.
 */
@Component
public class TrackStore {
  private final Map<String, Map<String, TaisTrack>> tracksByFacility = new ConcurrentHashMap<>();
  private final Clock clock;

  public TrackStore(Clock clock) {
    this.clock = clock;
  }

  /**
   * Gets or creates the track for {@code (facility, update.trackNum())} and applies the update.
   *
   * @param facility facility code
   * @param update normalized record
   * @return the live track instance
   */
  public TaisTrack upsert(String facility, TrackUpdate update) {
    Instant now = clock.instant();
    TaisTrack[] applied = new TaisTrack[1];
    tracksByFacility.compute(facility, (key, tracks) -> {
      Map<String, TaisTrack> bucket = tracks != null ? tracks : new ConcurrentHashMap<>();
      TaisTrack track = bucket.computeIfAbsent(update.trackNum(), id -> new TaisTrack(key, id, now));
      track.apply(update, now);
      applied[0] = track;
      return bucket;
    });
    return applied[0];
  }

  public Optional<TaisTrack> find(String facility, String trackNum) {
    Map<String, TaisTrack> tracks = tracksByFacility.get(facility);
    return tracks == null ? Optional.empty() : Optional.ofNullable(tracks.get(trackNum));
  }

  /** Returns a point-in-time copy of the facility's tracks, unordered. */
  public List<TaisTrack> listTracks(String facility) {
    Map<String, TaisTrack> tracks = tracksByFacility.get(facility);
    return tracks == null ? List.of() : new ArrayList<>(tracks.values());
  }

  /**
   * Removes one track; drops the facility when it becomes empty.
   *
   * @return {@code true} when the track existed
   */
  public boolean remove(String facility, String trackNum) {
    boolean[] removed = new boolean[1];
    tracksByFacility.computeIfPresent(facility, (key, tracks) -> {
      removed[0] = tracks.remove(trackNum) != null;
      return tracks.isEmpty() ? null : tracks;
    });
    return removed[0];
  }

  /**
   * Removes every track of {@code facility} last seen before {@code cutoff}.
   *
   * @return removed tracks, empty when nothing was stale
   */
  public List<TaisTrack> evictStale(String facility, Instant cutoff) {
    List<TaisTrack> evicted = new ArrayList<>();
    tracksByFacility.computeIfPresent(facility, (key, tracks) -> {
      tracks.values().removeIf(track -> {
        if (track.isStale(cutoff)) {
          evicted.add(track);
          return true;
        }
        return false;
      });
      return tracks.isEmpty() ? null : tracks;
    });
    return evicted;
  }

  public Set<String> facilities() {
    return Set.copyOf(tracksByFacility.keySet());
  }

  /** Track count per facility, skipping empty buckets. */
  public Map<String, Integer> trackCounts() {
    Map<String, Integer> counts = new LinkedHashMap<>();
    tracksByFacility.forEach((facility, tracks) -> {
      int size = tracks.size();
      if (size > 0) {
        counts.put(facility, size);
      }
    });
    return counts;
  }

  public int totalTracks() {
    return tracksByFacility.values().stream().mapToInt(Map::size).sum();
  }

  public int facilityCount() {
    return tracksByFacility.size();
  }
}
