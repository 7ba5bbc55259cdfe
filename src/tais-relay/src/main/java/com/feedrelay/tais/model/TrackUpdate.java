package com.feedrelay.tais.model;

/**
 * One normalized per-track field update extracted from a TAIS record.
 *
 * <p>{@code trackNum}, {@code lat} and {@code lon} are always present. Every other component is
 * {@code null} when the source field was absent, blank, an unset sentinel, or failed to parse;
 * {@code null} means "leave the stored value unchanged".
 */
public record TrackUpdate(
    String trackNum,
    double lat,
    double lon,
    String reportedSquawk,
    Integer altitudeFeet,
    Integer verticalRateFpm,
    Boolean frozen,
    Boolean pseudo,
    String modeSCode,
    Integer groundSpeedKnots,
    Integer groundTrackDegrees,
    FlightPlanFields flightPlan,
    EnhancedFields enhanced) {

  /** Fields from the optional {@code flightPlan} sub-block. */
  public record FlightPlanFields(
      String callsign,
      String aircraftType,
      String flightRules,
      String entryFix,
      String exitFix,
      String assignedSquawk,
      Integer requestedAltitude,
      String runway,
      String scratchpad1,
      String scratchpad2,
      String owner,
      String wakeCategory,
      String equipmentSuffix,
      String pendingHandoff) {}

  /** Fields from the optional {@code enhancedData} sub-block. */
  public record EnhancedFields(String origin, String destination) {}
}
