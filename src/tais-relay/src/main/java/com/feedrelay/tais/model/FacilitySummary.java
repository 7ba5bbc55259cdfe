package com.feedrelay.tais.model;

/**
 * One directory entry.
 *
 * @param facility facility code
 * @param trackCount number of live tracks
 */
public record FacilitySummary(String facility, int trackCount) {}
