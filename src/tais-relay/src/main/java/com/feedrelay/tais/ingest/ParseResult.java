package com.feedrelay.tais.ingest;

import com.feedrelay.tais.model.TrackUpdate;
import java.util.List;

/**
 * Outcome of normalizing one forwarded TAIS message.
 *
 * <p>The parser never throws for bad input; callers inspect {@link #status()} and log or count
 * the result instead.
 *
 * @param status overall classification
 * @param facility facility code from {@code <src>}, {@code null} unless accepted
 * @param updates per-track updates in document order
 * @param skippedRecords records dropped for missing identity or position
 * @param errorCategory failure category (exception simple name) for malformed input
 * @param errorMessage failure detail for malformed input
 */
public record ParseResult(
    Status status,
    String facility,
    List<TrackUpdate> updates,
    int skippedRecords,
    String errorCategory,
    String errorMessage) {

  /** Classification of a parse attempt. */
  public enum Status {
    ACCEPTED,
    IGNORED_TOPIC,
    IGNORED_SCHEMA,
    MALFORMED
  }

  static ParseResult accepted(String facility, List<TrackUpdate> updates, int skippedRecords) {
    return new ParseResult(Status.ACCEPTED, facility, List.copyOf(updates), skippedRecords, null, null);
  }

  static ParseResult ignored(Status status) {
    return new ParseResult(status, null, List.of(), 0, null, null);
  }

  static ParseResult malformed(String category, String message) {
    return new ParseResult(Status.MALFORMED, null, List.of(), 0, category, message);
  }
}
