package com.codeheadsystems.keyreg.client.manager;

import com.codeheadsystems.keyreg.client.accessor.DiagnosticDecoder;
import com.codeheadsystems.keyreg.client.accessor.RegistrationAccessor;
import com.codeheadsystems.keyreg.client.config.RegistrationClientConfig;
import com.codeheadsystems.keyreg.client.exceptions.RegistrationTransportException;
import com.codeheadsystems.keyreg.client.model.RegistrationOutcome;
import com.codeheadsystems.keyreg.client.model.ServerConnectionInfo;
import com.codeheadsystems.keyreg.model.RegistrationRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintStream;
import java.util.Objects;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for publishing a user and their public key to a registration server on the local host.
 * <p>
 * The call is single-shot and blocking. A rejection is reported, by printing its diagnostic, and
 * returned as a {@link RegistrationOutcome.Failure}; it does not raise. Only a transport failure
 * escapes as {@link RegistrationTransportException}.
 */
@Singleton
public class RegistrationManager {

  private static final Logger log = LoggerFactory.getLogger(RegistrationManager.class);

  private final RegistrationAccessor accessor;
  private final PrintStream out;

  /**
   * Instantiates a new Registration manager that reports to standard output.
   *
   * @param accessor the accessor
   */
  @Inject
  public RegistrationManager(final RegistrationAccessor accessor) {
    this(accessor, System.out);
  }

  /**
   * Instantiates a new Registration manager.
   *
   * @param accessor the accessor
   * @param out      where diagnostics are printed
   */
  public RegistrationManager(final RegistrationAccessor accessor, final PrintStream out) {
    log.info("RegistrationManager()");
    this.accessor = accessor;
    this.out = out;
  }

  /**
   * Wires a manager with the default configuration and a fresh {@link ObjectMapper}.
   *
   * @return the registration manager
   */
  public static RegistrationManager create() {
    return create(RegistrationClientConfig.defaults());
  }

  /**
   * Wires a manager with the given configuration.
   *
   * @param config the config
   * @return the registration manager
   */
  public static RegistrationManager create(final RegistrationClientConfig config) {
    ObjectMapper objectMapper = new ObjectMapper();
    return new RegistrationManager(new RegistrationAccessor(
        RegistrationAccessor.defaultHttpClientProvider(),
        objectMapper,
        new DiagnosticDecoder(objectMapper),
        config));
  }

  /**
   * Publishes {@code user} and {@code key} to {@code http://localhost:<port>/api/register}.
   *
   * @param port the server port, 1 to 65535
   * @param user the identity name, forwarded verbatim
   * @param key  the public key, forwarded verbatim
   * @return the outcome
   * @throws IllegalArgumentException       if the port is out of range
   * @throws RegistrationTransportException if the server could not be reached or did not answer in time
   */
  public RegistrationOutcome register(final int port, final String user, final String key) {
    log.debug("register(port={}, name={})", port, user);
    Objects.requireNonNull(user, "user");
    Objects.requireNonNull(key, "key");
    ServerConnectionInfo server = ServerConnectionInfo.forLocalPort(port);
    RegistrationOutcome outcome = accessor.register(server, new RegistrationRequest(user, key));
    if (outcome instanceof RegistrationOutcome.Failure failure) {
      report(failure);
    }
    return outcome;
  }

  private void report(final RegistrationOutcome.Failure failure) {
    out.println(failure.diagnostic().render());
  }
}
