package com.feedrelay.tais.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Live state of one STARS terminal track within a facility.
 *
 * <p>Identity ({@code facility}, {@code trackNum}) is fixed at creation. All mutation goes through
 * {@link #apply(TrackUpdate, Instant)}, which overwrites only the fields the update carries;
 * position and {@code lastSeen} are always overwritten. Reads and writes are guarded by the
 * instance monitor so a serializer never observes a half-applied update.
 */
public class TaisTrack {
  private final String facility;
  private final String trackNum;

  private String callsign;
  private String aircraftType;
  private String equipmentSuffix;
  private String wakeCategory;
  private String flightRules;
  private String origin;
  private String destination;
  private String entryFix;
  private String exitFix;
  private String assignedSquawk;
  private String reportedSquawk;
  private Integer requestedAltitude;
  private String runway;
  private String scratchpad1;
  private String scratchpad2;
  private String owner;
  private String pendingHandoff;

  private double latitude;
  private double longitude;
  private Integer altitudeFeet;
  private Integer groundSpeedKnots;
  private Integer groundTrackDegrees;
  private Integer verticalRateFpm;
  private String modeSCode;
  private boolean frozen;
  private boolean pseudo;
  private Instant lastSeen;

  public TaisTrack(String facility, String trackNum, Instant createdAt) {
    this.facility = facility;
    this.trackNum = trackNum;
    this.lastSeen = createdAt;
  }

  public String facility() {
    return facility;
  }

  public String trackNum() {
    return trackNum;
  }

  public synchronized String callsign() {
    return callsign;
  }

  public synchronized double latitude() {
    return latitude;
  }

  public synchronized double longitude() {
    return longitude;
  }

  public synchronized Instant lastSeen() {
    return lastSeen;
  }

  public synchronized boolean isStale(Instant cutoff) {
    return lastSeen.isBefore(cutoff);
  }

  /** Key used for snapshot ordering: callsign when known, otherwise the track number. */
  public synchronized String sortKey() {
    return callsign != null ? callsign : trackNum;
  }

  /**
   * Applies one normalized update.
   *
   * @param update parsed record for this track
   * @param seenAt ingestion time recorded as {@code lastSeen}
   */
  public synchronized void apply(TrackUpdate update, Instant seenAt) {
    latitude = update.lat();
    longitude = update.lon();
    lastSeen = seenAt;

    reportedSquawk = keep(update.reportedSquawk(), reportedSquawk);
    altitudeFeet = keep(update.altitudeFeet(), altitudeFeet);
    verticalRateFpm = keep(update.verticalRateFpm(), verticalRateFpm);
    frozen = keep(update.frozen(), frozen);
    pseudo = keep(update.pseudo(), pseudo);
    modeSCode = keep(update.modeSCode(), modeSCode);
    groundSpeedKnots = keep(update.groundSpeedKnots(), groundSpeedKnots);
    groundTrackDegrees = keep(update.groundTrackDegrees(), groundTrackDegrees);

    TrackUpdate.FlightPlanFields fp = update.flightPlan();
    if (fp != null) {
      callsign = keep(fp.callsign(), callsign);
      aircraftType = keep(fp.aircraftType(), aircraftType);
      flightRules = keep(fp.flightRules(), flightRules);
      entryFix = keep(fp.entryFix(), entryFix);
      exitFix = keep(fp.exitFix(), exitFix);
      assignedSquawk = keep(fp.assignedSquawk(), assignedSquawk);
      requestedAltitude = keep(fp.requestedAltitude(), requestedAltitude);
      runway = keep(fp.runway(), runway);
      scratchpad1 = keep(fp.scratchpad1(), scratchpad1);
      scratchpad2 = keep(fp.scratchpad2(), scratchpad2);
      owner = keep(fp.owner(), owner);
      wakeCategory = keep(fp.wakeCategory(), wakeCategory);
      equipmentSuffix = keep(fp.equipmentSuffix(), equipmentSuffix);
      pendingHandoff = keep(fp.pendingHandoff(), pendingHandoff);
    }

    TrackUpdate.EnhancedFields enhanced = update.enhanced();
    if (enhanced != null) {
      origin = keep(enhanced.origin(), origin);
      destination = keep(enhanced.destination(), destination);
    }
  }

  /**
   * Builds the wire projection of this track.
   *
   * @param now reference time for {@code ageSec}
   * @return immutable view with contract field names
   */
  public synchronized TrackView toView(Instant now) {
    long ageSec = Math.max(0L, Duration.between(lastSeen, now).getSeconds());
    return new TrackView(
        facility,
        trackNum,
        callsign,
        aircraftType,
        equipmentSuffix,
        wakeCategory,
        flightRules,
        origin,
        destination,
        entryFix,
        exitFix,
        assignedSquawk,
        reportedSquawk,
        requestedAltitude,
        runway,
        scratchpad1,
        scratchpad2,
        owner,
        pendingHandoff,
        latitude,
        longitude,
        altitudeFeet,
        groundSpeedKnots,
        groundTrackDegrees,
        verticalRateFpm,
        modeSCode,
        frozen,
        pseudo,
        (int) ageSec);
  }

  private static <T> T keep(T incoming, T current) {
    return incoming != null ? incoming : current;
  }
}
