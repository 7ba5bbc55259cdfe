package com.feedrelay.tais.model;

/**
 * Payload of a {@code remove} envelope.
 *
 * @param facility facility code of the evicted track
 * @param trackNum facility-scoped track number
 */
public record TrackRemoval(String facility, String trackNum) {}
