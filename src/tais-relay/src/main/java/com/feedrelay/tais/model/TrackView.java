package com.feedrelay.tais.model;

/**
 * Track projection sent to clients in snapshot and batch envelopes.
 *
 * <p>Component names are the wire contract. {@code ageSec} is computed at serialization time.
 */
public record TrackView(
    String facility,
    String trackNum,
    String callsign,
    String acType,
    String equip,
    String wake,
    String rules,
    String origin,
    String dest,
    String entryFix,
    String exitFix,
    String assignedSqk,
    String reportedSqk,
    Integer reqAlt,
    String runway,
    String sp1,
    String sp2,
    String owner,
    String handoff,
    double lat,
    double lon,
    Integer altFt,
    Integer gs,
    Integer trk,
    Integer vs,
    String modeS,
    boolean frozen,
    boolean pseudo,
    int ageSec) {}
