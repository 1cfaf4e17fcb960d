package com.codeheadsystems.keyreg.client.accessor;

import com.codeheadsystems.keyreg.client.model.Diagnostic;
import com.codeheadsystems.keyreg.client.model.Diagnostic.StructuredDiagnostic;
import com.codeheadsystems.keyreg.client.model.Diagnostic.TextDiagnostic;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the body of a rejected response into a {@link Diagnostic}.
 * <p>
 * JSON is tried first. Only when the body is empty or is not a single JSON value does the raw
 * text become the diagnostic.
 */
@Singleton
public class DiagnosticDecoder {

  private static final Logger log = LoggerFactory.getLogger(DiagnosticDecoder.class);

  private final ObjectReader reader;

  /**
   * Instantiates a new Diagnostic decoder.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public DiagnosticDecoder(final ObjectMapper objectMapper) {
    this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /**
   * Decode diagnostic.
   *
   * @param body the response body, may be null
   * @return the diagnostic
   */
  public Diagnostic decode(final String body) {
    if (body == null || body.isBlank()) {
      return new TextDiagnostic(body == null ? "" : body);
    }
    try {
      JsonNode node = reader.readTree(body);
      if (node == null || node.isMissingNode()) {
        return new TextDiagnostic(body);
      }
      return new StructuredDiagnostic(node);
    } catch (JsonProcessingException e) {
      log.debug("decode(): body is not JSON, using raw text ({})", e.getOriginalMessage());
      return new TextDiagnostic(body);
    }
  }
}
