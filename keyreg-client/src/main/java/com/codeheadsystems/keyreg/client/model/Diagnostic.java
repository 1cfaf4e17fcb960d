package com.codeheadsystems.keyreg.client.model;

import com.codeheadsystems.keyreg.model.ErrorResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;
import java.util.Optional;

/**
 * Human-facing payload extracted from a rejected registration.
 * <p>
 * The body of a failed response is decoded as JSON when possible ({@link StructuredDiagnostic});
 * anything else is kept as the raw response text ({@link TextDiagnostic}).
 */
public sealed interface Diagnostic permits Diagnostic.StructuredDiagnostic, Diagnostic.TextDiagnostic {

  /**
   * The single line reported to the user for this diagnostic.
   *
   * @return the rendered diagnostic
   */
  String render();

  /**
   * A response body that decoded as a JSON value.
   *
   * @param value the decoded value
   */
  record StructuredDiagnostic(JsonNode value) implements Diagnostic {

    public StructuredDiagnostic {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String render() {
      return value.toString();
    }

    /**
     * Views the value as the server's standard error body, if it has that shape.
     *
     * @param objectMapper the object mapper
     * @return the error response, or empty when the value is not an object with a textual message
     */
    public Optional<ErrorResponse> asErrorResponse(final ObjectMapper objectMapper) {
      if (!value.isObject() || !value.path("message").isTextual()) {
        return Optional.empty();
      }
      return Optional.of(objectMapper.convertValue(value, ErrorResponse.class));
    }
  }

  /**
   * A response body that was not JSON, kept verbatim.
   *
   * @param text the raw body
   */
  record TextDiagnostic(String text) implements Diagnostic {

    public TextDiagnostic {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public String render() {
      return text;
    }
  }
}
