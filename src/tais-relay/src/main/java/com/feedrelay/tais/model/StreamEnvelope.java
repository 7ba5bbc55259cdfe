package com.feedrelay.tais.model;

import java.util.List;

/**
 * Outbound stream message with a {@code type} discriminator.
 *
 * @param type one of {@code snapshot}, {@code batch}, {@code remove}
 * @param payload track array for snapshot/batch, {@link TrackRemoval} for remove
 */
public record StreamEnvelope(String type, Object payload) {
  public static final String SNAPSHOT = "snapshot";
  public static final String BATCH = "batch";
  public static final String REMOVE = "remove";

  public static StreamEnvelope snapshot(List<TrackView> tracks) {
    return new StreamEnvelope(SNAPSHOT, tracks);
  }

  public static StreamEnvelope batch(List<TrackView> tracks) {
    return new StreamEnvelope(BATCH, tracks);
  }

  public static StreamEnvelope remove(String facility, String trackNum) {
    return new StreamEnvelope(REMOVE, new TrackRemoval(facility, trackNum));
  }
}
