package com.codeheadsystems.keyreg.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.keyreg.client.accessor.RegistrationAccessor;
import com.codeheadsystems.keyreg.client.exceptions.RegistrationTransportException;
import com.codeheadsystems.keyreg.client.model.Diagnostic;
import com.codeheadsystems.keyreg.client.model.RegistrationOutcome;
import com.codeheadsystems.keyreg.client.model.ServerConnectionInfo;
import com.codeheadsystems.keyreg.model.RegistrationRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link RegistrationManager} with the {@link RegistrationAccessor} mocked out.
 */
@ExtendWith(MockitoExtension.class)
class RegistrationManagerTest {

  private static final ServerConnectionInfo SERVER = ServerConnectionInfo.forLocalPort(3000);
  private static final RegistrationRequest REQUEST = new RegistrationRequest("alice", "pk-alice");

  @Mock private RegistrationAccessor accessor;

  private ByteArrayOutputStream printed;
  private RegistrationManager manager;

  @BeforeEach
  void setUp() {
    printed = new ByteArrayOutputStream();
    manager = new RegistrationManager(accessor, new PrintStream(printed, true, StandardCharsets.UTF_8));
  }

  private String printed() {
    return printed.toString(StandardCharsets.UTF_8);
  }

  @Test
  void register_success_printsNothing() {
    when(accessor.register(SERVER, REQUEST)).thenReturn(RegistrationOutcome.success());

    RegistrationOutcome outcome = manager.register(3000, "alice", "pk-alice");

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(printed()).isEmpty();
  }

  @Test
  void register_structuredFailure_printsJsonAndReturnsFailure() throws Exception {
    Diagnostic diagnostic = new Diagnostic.StructuredDiagnostic(
        new ObjectMapper().readTree("{\"error\":\"bad key\"}"));
    when(accessor.register(SERVER, REQUEST)).thenReturn(new RegistrationOutcome.Failure(400, diagnostic));

    RegistrationOutcome outcome = manager.register(3000, "alice", "pk-alice");

    assertThat(outcome).isEqualTo(new RegistrationOutcome.Failure(400, diagnostic));
    assertThat(printed()).isEqualTo("{\"error\":\"bad key\"}" + System.lineSeparator());
  }

  @Test
  void register_textFailure_printsRawText() {
    when(accessor.register(SERVER, REQUEST)).thenReturn(
        new RegistrationOutcome.Failure(500, new Diagnostic.TextDiagnostic("internal error")));

    manager.register(3000, "alice", "pk-alice");

    assertThat(printed()).isEqualTo("internal error" + System.lineSeparator());
  }

  @Test
  void register_transportFailure_propagates() {
    RegistrationTransportException failure = new RegistrationTransportException(
        "HTTP request failed", URI.create("http://localhost:3000/api/register"), null);
    when(accessor.register(any(), any())).thenThrow(failure);

    assertThatThrownBy(() -> manager.register(3000, "alice", "pk-alice")).isSameAs(failure);
    assertThat(printed()).isEmpty();
  }

  @Test
  void register_forwardsValuesVerbatim() {
    when(accessor.register(any(), any())).thenReturn(RegistrationOutcome.success());

    manager.register(65535, "  spaced name ", "");

    verify(accessor).register(eq(ServerConnectionInfo.forLocalPort(65535)),
        eq(new RegistrationRequest("  spaced name ", "")));
  }

  @Test
  void register_portOutOfRange_throwsBeforeAnyRequest() {
    assertThatThrownBy(() -> manager.register(0, "alice", "pk-alice"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("0");
    assertThatThrownBy(() -> manager.register(65536, "alice", "pk-alice"))
        .isInstanceOf(IllegalArgumentException.class);

    verifyNoInteractions(accessor);
  }
}
