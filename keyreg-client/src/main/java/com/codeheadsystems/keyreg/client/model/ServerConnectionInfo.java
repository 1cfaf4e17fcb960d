package com.codeheadsystems.keyreg.client.model;

import java.net.URI;
import java.util.Objects;

/**
 * Network connection details for a registration server.
 *
 * @param endpoint The base URI of the server (e.g. http://localhost:8080), without the API path.
 */
public record ServerConnectionInfo(URI endpoint) {

  /**
   * Lowest valid TCP port.
   */
  public static final int MIN_PORT = 1;
  /**
   * Highest valid TCP port.
   */
  public static final int MAX_PORT = 65535;

  public ServerConnectionInfo {
    Objects.requireNonNull(endpoint, "endpoint");
  }

  /**
   * Connection info for a server listening on the local host.
   *
   * @param port the TCP port, 1 to 65535
   * @return the server connection info for {@code http://localhost:<port>}
   * @throws IllegalArgumentException if the port is out of range
   */
  public static ServerConnectionInfo forLocalPort(final int port) {
    if (port < MIN_PORT || port > MAX_PORT) {
      throw new IllegalArgumentException("Port out of range: " + port);
    }
    return new ServerConnectionInfo(URI.create("http://localhost:" + port));
  }

  /**
   * Appends an absolute API path to the base endpoint.
   *
   * @param path the path, starting with '/'
   * @return the full request URI
   */
  public URI resolve(final String path) {
    String base = endpoint.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + path);
  }
}
