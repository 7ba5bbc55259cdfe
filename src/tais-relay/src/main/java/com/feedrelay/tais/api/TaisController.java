package com.feedrelay.tais.api;

import com.feedrelay.tais.ingest.TaisIngestService;
import com.feedrelay.tais.model.FacilitySnapshot;
import com.feedrelay.tais.model.FacilitySummary;
import com.feedrelay.tais.query.TrackQueryService;
import com.feedrelay.tais.stream.SseStreamService;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * HTTP surface of the TAIS relay.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /api/tais/facilities}: facility directory with track counts</li>
 *   <li>{@code GET /api/tais/facilities/{facility}}: full facility snapshot</li>
 *   <li>{@code GET /api/tais/facilities/{facility}/stream}: SSE snapshot-then-batch stream</li>
 *   <li>{@code POST /api/tais/messages?topic=...}: bridge forward of one raw broker message</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/tais")
public class TaisController {
  private static final Pattern FACILITY_CODE = Pattern.compile("[A-Za-z0-9]{1,16}");

  private final TrackQueryService queryService;
  private final SseStreamService streamService;
  private final TaisIngestService ingestService;

  public TaisController(
      TrackQueryService queryService,
      SseStreamService streamService,
      TaisIngestService ingestService) {
    this.queryService = queryService;
    this.streamService = streamService;
    this.ingestService = ingestService;
  }

  @GetMapping("/facilities")
  public List<FacilitySummary> directory() {
    return queryService.directory();
  }

  @GetMapping("/facilities/{facility}")
  public FacilitySnapshot snapshot(@PathVariable("facility") String facility) {
    return queryService.snapshot(requireFacility(facility));
  }

  /**
   * Opens a facility stream. The first event carries a {@code snapshot} envelope, later events
   * carry {@code batch} and {@code remove} envelopes.
   *
   * @param facility facility code
   * @return emitter bound to a new subscription
   */
  @GetMapping(path = "/facilities/{facility}/stream",
      produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter stream(@PathVariable("facility") String facility) {
    return streamService.openStream(requireFacility(facility));
  }

  /**
   * Accepts one forwarded broker message. Malformed or foreign messages are still accepted;
   * the relay drops them internally.
   *
   * @param topic broker topic, e.g. {@code TAIS/N90}
   * @param body raw XML body
   * @return 202 with the number of applied records
   */
  @PostMapping(path = "/messages", consumes = {MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE,
      MediaType.TEXT_PLAIN_VALUE})
  public ResponseEntity<ForwardResponse> forward(
      @RequestParam(value = "topic", required = false) String topic,
      @RequestBody(required = false) String body) {
    if (topic == null || topic.isBlank()) {
      throw new BadRequestException("topic is required");
    }
    int applied = ingestService.processMessage(topic, body);
    return ResponseEntity.accepted().body(new ForwardResponse(applied));
  }

  private static String requireFacility(String facility) {
    if (facility == null || !FACILITY_CODE.matcher(facility).matches()) {
      throw new BadRequestException("facility must match " + FACILITY_CODE.pattern());
    }
    return facility;
  }

  /**
   * Response for the forward endpoint.
   *
   * @param appliedRecords track records applied from the message
   */
  public record ForwardResponse(int appliedRecords) {}
}
