package com.codeheadsystems.keyreg.client.model;

import java.util.Objects;

/**
 * Result of a registration attempt that reached the server.
 * <p>
 * Transport failures never produce an outcome; they are raised as
 * {@link com.codeheadsystems.keyreg.client.exceptions.RegistrationTransportException}.
 */
public sealed interface RegistrationOutcome permits RegistrationOutcome.Success, RegistrationOutcome.Failure {

  /**
   * The accepted outcome.
   *
   * @return the success singleton
   */
  static Success success() {
    return Success.INSTANCE;
  }

  /**
   * Whether the server accepted the registration.
   *
   * @return true when the server answered 2xx
   */
  boolean isSuccess();

  /**
   * The server accepted the registration (2xx). Carries no data, the response body is ignored.
   */
  final class Success implements RegistrationOutcome {

    private static final Success INSTANCE = new Success();

    private Success() {
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public String toString() {
      return "Success";
    }
  }

  /**
   * The server rejected the registration with a non-2xx status.
   *
   * @param statusCode the HTTP status returned
   * @param diagnostic what the server said about it
   */
  record Failure(int statusCode, Diagnostic diagnostic) implements RegistrationOutcome {

    public Failure {
      Objects.requireNonNull(diagnostic, "diagnostic");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }
  }
}
