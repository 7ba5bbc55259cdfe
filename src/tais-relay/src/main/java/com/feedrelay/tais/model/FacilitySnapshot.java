package com.feedrelay.tais.model;

import java.util.List;

/**
 * Response contract for a single facility snapshot.
 *
 * @param facility requested facility code
 * @param tracks tracks ordered by callsign, falling back to track number
 */
public record FacilitySnapshot(String facility, List<TrackView> tracks) {}
