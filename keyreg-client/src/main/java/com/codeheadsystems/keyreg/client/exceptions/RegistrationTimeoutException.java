package com.codeheadsystems.keyreg.client.exceptions;

import java.net.URI;

/**
 * No response within the configured timeout.
 */
public class RegistrationTimeoutException extends RegistrationTransportException {

  /**
   * Instantiates a new Registration timeout exception.
   *
   * @param message the message
   * @param uri     the target uri
   * @param cause   the cause
   */
  public RegistrationTimeoutException(final String message, final URI uri, final Throwable cause) {
    super(message, uri, cause);
  }
}
