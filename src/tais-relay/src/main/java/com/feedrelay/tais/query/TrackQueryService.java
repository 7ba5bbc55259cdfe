package com.feedrelay.tais.query;

import com.feedrelay.tais.model.FacilitySnapshot;
import com.feedrelay.tais.model.FacilitySummary;
import com.feedrelay.tais.model.TaisTrack;
import com.feedrelay.tais.model.TrackView;
import com.feedrelay.tais.state.TrackStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Read-only views over the track store: per-facility snapshot and facility directory.
 */
@Service
public class TrackQueryService {
  private static final Comparator<FacilitySummary> DIRECTORY_ORDER =
      Comparator.comparingInt(FacilitySummary::trackCount).reversed()
          .thenComparing(FacilitySummary::facility);

  private final TrackStore trackStore;
  private final Clock clock;

  public TrackQueryService(TrackStore trackStore, Clock clock) {
    this.trackStore = trackStore;
    this.clock = clock;
  }

  /**
   * Returns the facility's tracks ordered by callsign, falling back to track number.
   *
   * @param facility facility code; unknown facilities yield an empty list
   * @return snapshot payload
   */
  public FacilitySnapshot snapshot(String facility) {
    Instant now = clock.instant();
    List<TrackView> tracks = trackStore.listTracks(facility).stream()
        .sorted(Comparator.comparing(TaisTrack::sortKey).thenComparing(TaisTrack::trackNum))
        .map(track -> track.toView(now))
        .toList();
    return new FacilitySnapshot(facility, tracks);
  }

  /** Facilities holding at least one track, busiest first. */
  public List<FacilitySummary> directory() {
    Map<String, Integer> counts = trackStore.trackCounts();
    return counts.entrySet().stream()
        .map(entry -> new FacilitySummary(entry.getKey(), entry.getValue()))
        .sorted(DIRECTORY_ORDER)
        .toList();
  }
}
