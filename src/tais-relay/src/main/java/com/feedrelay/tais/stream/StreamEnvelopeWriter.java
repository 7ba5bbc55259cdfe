package com.feedrelay.tais.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.feedrelay.tais.model.StreamEnvelope;
import org.springframework.stereotype.Component;

/** Serializes outbound envelopes once so every client of a facility shares the same bytes. */
@Component
public class StreamEnvelopeWriter {
  private final ObjectMapper objectMapper;

  public StreamEnvelopeWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public byte[] write(StreamEnvelope envelope) {
    try {
      return objectMapper.writeValueAsBytes(envelope);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize " + envelope.type() + " envelope", ex);
    }
  }
}
