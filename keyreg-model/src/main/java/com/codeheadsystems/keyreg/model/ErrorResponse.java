package com.codeheadsystems.keyreg.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the error body returned by the registration server on a non-2xx status.
 * <p>
 * For example a failed publish to the peer network comes back as
 * {@code {"message":"kademlia error","detail":"QuorumFailed"}}, while a generic failure has no detail.
 *
 * @param message short, stable description of the failure category
 * @param detail  optional free-form detail, {@code null} when the server gives none
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorResponse(
    @JsonProperty("message") String message,
    @JsonProperty("detail") String detail) {
}
