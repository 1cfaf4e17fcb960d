package com.codeheadsystems.keyreg.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Wire model for publishing an identity and its public key.
 * <p>
 * Both values are opaque to the client and forwarded verbatim; the server owns all validation
 * (name format, key encoding, duplicate names).
 * <p>
 * Used by: {@code POST /api/register}
 *
 * @param name the identity name to register
 * @param key  the public key associated with the name, in whatever encoding the server expects
 */
@JsonPropertyOrder({"name", "key"})
public record RegistrationRequest(
    @JsonProperty("name") String name,
    @JsonProperty("key") String key) {

  @Override
  public String toString() {
    return "RegistrationRequest[name=" + name + "]";
  }
}
