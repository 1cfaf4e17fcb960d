package com.codeheadsystems.keyreg.client.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Client-side settings for the registration call.
 * <p>
 * The timeout bounds the whole exchange, connection establishment included. There is no
 * separate connect timeout and no retry.
 *
 * @param timeout the request timeout
 * @param path    the registration endpoint path, appended to the server base URI
 */
public record RegistrationClientConfig(Duration timeout, String path) {

  /**
   * The default timeout.
   */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
  /**
   * The default path.
   */
  public static final String DEFAULT_PATH = "/api/register";

  public RegistrationClientConfig {
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(path, "path");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("Timeout must be positive: " + timeout);
    }
    if (!path.startsWith("/")) {
      throw new IllegalArgumentException("Path must start with '/': " + path);
    }
  }

  /**
   * Ten seconds against {@code /api/register}.
   *
   * @return the registration client config
   */
  public static RegistrationClientConfig defaults() {
    return new RegistrationClientConfig(DEFAULT_TIMEOUT, DEFAULT_PATH);
  }

  /**
   * Copy with a different timeout.
   *
   * @param newTimeout the new timeout
   * @return the registration client config
   */
  public RegistrationClientConfig withTimeout(final Duration newTimeout) {
    return new RegistrationClientConfig(newTimeout, path);
  }
}
