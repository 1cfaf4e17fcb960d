package com.codeheadsystems.keyreg.client.accessor;

import com.codeheadsystems.keyreg.client.config.RegistrationClientConfig;
import com.codeheadsystems.keyreg.client.exceptions.RegistrationTimeoutException;
import com.codeheadsystems.keyreg.client.exceptions.RegistrationTransportException;
import com.codeheadsystems.keyreg.client.model.RegistrationOutcome;
import com.codeheadsystems.keyreg.client.model.ServerConnectionInfo;
import com.codeheadsystems.keyreg.model.RegistrationRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import javax.inject.Inject;
import javax.inject.Provider;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the registration endpoint.
 * <p>
 * Handles request serialization, the blocking HTTP dispatch, and status classification for
 * {@code POST /api/register}. A 2xx status is a {@link RegistrationOutcome.Success} and the body is
 * not read. Any other status is a {@link RegistrationOutcome.Failure} whose diagnostic comes from
 * {@link DiagnosticDecoder}; it is never raised.
 * <p>
 * I/O errors, timeouts and interruptions are wrapped in {@link RegistrationTransportException}.
 * Every call obtains its own {@link HttpClient} from the provider, so nothing is pooled between calls.
 */
@Singleton
public class RegistrationAccessor {

  private static final Logger log = LoggerFactory.getLogger(RegistrationAccessor.class);

  private final Provider<HttpClient> httpClientProvider;
  private final ObjectMapper objectMapper;
  private final DiagnosticDecoder diagnosticDecoder;
  private final RegistrationClientConfig config;

  /**
   * Instantiates a new Registration accessor.
   *
   * @param httpClientProvider the http client provider
   * @param objectMapper       the object mapper
   * @param diagnosticDecoder  the diagnostic decoder
   * @param config             the config
   */
  @Inject
  public RegistrationAccessor(final Provider<HttpClient> httpClientProvider,
                              final ObjectMapper objectMapper,
                              final DiagnosticDecoder diagnosticDecoder,
                              final RegistrationClientConfig config) {
    log.info("RegistrationAccessor({})", config);
    this.httpClientProvider = httpClientProvider;
    this.objectMapper = objectMapper;
    this.diagnosticDecoder = diagnosticDecoder;
    this.config = config;
  }

  /**
   * The transport used when nothing else is wired in: a fresh HTTP/1.1 client that does not follow
   * redirects.
   *
   * @return the provider
   */
  public static Provider<HttpClient> defaultHttpClientProvider() {
    return () -> HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
  }

  /**
   * Sends the registration and classifies the response.
   *
   * @param server  the server to register with
   * @param request the name and key to publish
   * @return the outcome, success or a failure with its diagnostic
   * @throws RegistrationTransportException if no response was received
   */
  public RegistrationOutcome register(final ServerConnectionInfo server,
                                      final RegistrationRequest request) {
    URI uri = server.resolve(config.path());
    log.debug("register(uri={}, name={})", uri, request.name());
    HttpRequest httpRequest = buildRequest(uri, request);
    HttpResponse<String> response = send(uri, httpRequest);
    return classify(uri, response);
  }

  HttpRequest buildRequest(final URI uri, final RegistrationRequest request) {
    return HttpRequest.newBuilder()
        .uri(uri)
        .timeout(config.timeout())
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(serialize(request)))
        .build();
  }

  private String serialize(final RegistrationRequest request) {
    try {
      return objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize registration request", e);
    }
  }

  private HttpResponse<String> send(final URI uri, final HttpRequest httpRequest) {
    try {
      return httpClientProvider.get().send(httpRequest, HttpResponse.BodyHandlers.ofString());
    } catch (HttpTimeoutException e) {
      throw new RegistrationTimeoutException(
          "No response within " + config.timeout() + " from: " + uri, uri, e);
    } catch (IOException e) {
      throw new RegistrationTransportException("HTTP request failed for: " + uri, uri, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RegistrationTransportException("HTTP request interrupted for: " + uri, uri, e);
    }
  }

  private RegistrationOutcome classify(final URI uri, final HttpResponse<String> response) {
    int statusCode = response.statusCode();
    if (statusCode >= 200 && statusCode < 300) {
      log.debug("classify(uri={}): accepted with {}", uri, statusCode);
      return RegistrationOutcome.success();
    }
    log.warn("Server returned HTTP {} for: {}", statusCode, uri);
    return new RegistrationOutcome.Failure(statusCode, diagnosticDecoder.decode(response.body()));
  }
}
