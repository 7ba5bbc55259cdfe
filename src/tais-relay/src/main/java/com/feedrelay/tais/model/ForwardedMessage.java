package com.feedrelay.tais.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw broker message forwarded by the upstream bridge through Redis.
 *
 * <p>Unknown JSON attributes are ignored so the bridge can add metadata freely.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ForwardedMessage(
    @JsonProperty("topic") String topic,
    @JsonProperty("body") String body) {}
