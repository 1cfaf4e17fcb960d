package com.codeheadsystems.keyreg.client.exceptions;

import java.net.URI;

/**
 * The registration request never produced an HTTP response: the connection was refused, the host
 * could not be resolved, the exchange timed out, or the calling thread was interrupted.
 */
public class RegistrationTransportException extends RuntimeException {

  private final URI uri;

  /**
   * Instantiates a new Registration transport exception.
   *
   * @param message the message
   * @param uri     the target uri
   * @param cause   the cause
   */
  public RegistrationTransportException(final String message, final URI uri, final Throwable cause) {
    super(message, cause);
    this.uri = uri;
  }

  /**
   * The URI the request was sent to.
   *
   * @return the uri
   */
  public URI uri() {
    return uri;
  }
}
