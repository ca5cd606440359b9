package com.example.businessapi.core.errors;

import static java.lang.System.Logger.Level.ERROR;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a non-2xx response into the exception surfaced to callers.
 *
 * <p>A body of the form {@code {"errors": [...]}} yields an {@link ApiErrorException} built from
 * the first entry; anything else yields an {@link HttpStatusException} with a body snippet. Every
 * structured entry is logged at {@code ERROR}.
 */
public final class ErrorClassifier {

  private static final System.Logger LOGGER = System.getLogger(ErrorClassifier.class.getName());

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public ErrorClassifier() {
    this(new ObjectMapper());
  }

  public ErrorClassifier(final ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Classifies a response without request details in the log output.
   *
   * @param status HTTP status code
   * @param body raw response body, may be null
   * @return the exception to throw
   */
  public HttpStatusException classify(final int status, final byte[] body) {
    return classify(status, body, "");
  }

  /**
   * Classifies a response.
   *
   * @param status HTTP status code
   * @param body raw response body, may be null
   * @param request request line used in log output, e.g. {@code GET /v1/orgDevices}
   * @return the exception to throw
   */
  public HttpStatusException classify(final int status, final byte[] body, final String request) {
    final var text = body == null ? "" : new String(body, StandardCharsets.UTF_8);
    final var errors = parseErrors(text);

    if (errors.isEmpty()) {
      LOGGER.log(
          ERROR,
          "API request failed (no structured error): status={0} request={1} body={2}",
          status,
          request,
          HttpStatusException.snippet(text));
      return new HttpStatusException(status, text);
    }

    for (var i = 0; i < errors.size(); i++) {
      final var error = errors.get(i);
      LOGGER.log(
          ERROR,
          "API request failed: index={0} id={1} status={2} code={3} title={4} detail={5}"
              + " source={6} links={7} meta={8} request={9}",
          i,
          error.id(),
          error.status(),
          error.code(),
          error.title(),
          error.detail(),
          error.source(),
          error.links(),
          error.meta(),
          request);
    }
    return new ApiErrorException(status, errors, text);
  }

  /**
   * Extracts the error entries of an error envelope.
   *
   * @param body response body text
   * @return entries in order, empty when the body is not an error envelope
   */
  List<ApiError> parseErrors(final String body) {
    if (body == null || body.isBlank()) return List.of();

    final JsonNode root;
    try {
      root = mapper.readTree(body);
    } catch (final JsonProcessingException e) {
      return List.of();
    }

    final var array = root == null ? null : root.get("errors");
    if (array == null || !array.isArray()) return List.of();

    final var errors = new ArrayList<ApiError>(array.size());
    for (final var node : array) {
      if (node.isObject()) errors.add(toApiError(node));
    }
    return errors;
  }

  private ApiError toApiError(final JsonNode node) {
    return new ApiError(
        text(node, "id"),
        text(node, "status"),
        text(node, "code"),
        text(node, "title"),
        text(node, "detail"),
        source(node.get("source")),
        links(node.get("links")),
        map(node.get("meta")));
  }

  private static ApiError.Source source(final JsonNode node) {
    if (node == null || !node.isObject()) return null;
    // pointer may be flat or nested under jsonPointer
    final var pointer =
        Optional.ofNullable(text(node, "pointer"))
            .orElseGet(() -> nested(node, "jsonPointer", "pointer"));
    final var parameter =
        Optional.ofNullable(node.get("parameter"))
            .map(p -> p.isObject() ? text(p, "parameter") : p.asText())
            .orElse(null);
    return new ApiError.Source(pointer, parameter);
  }

  private ApiError.Links links(final JsonNode node) {
    if (node == null || !node.isObject()) return null;
    final var associated = node.get("associated");
    if (associated == null || associated.isNull())
      return new ApiError.Links(text(node, "about"), null, Map.of());
    if (associated.isTextual())
      return new ApiError.Links(text(node, "about"), associated.asText(), Map.of());
    return new ApiError.Links(
        text(node, "about"), text(associated, "href"), map(associated.get("meta")));
  }

  private Map<String, Object> map(final JsonNode node) {
    if (node == null || !node.isObject()) return Map.of();
    final Map<String, Object> values = mapper.convertValue(node, MAP_TYPE);
    values.values().removeIf(v -> v == null);
    return values;
  }

  private static String nested(final JsonNode node, final String parent, final String field) {
    final var child = node.get(parent);
    return child == null ? null : text(child, field);
  }

  private static String text(final JsonNode node, final String field) {
    final var value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }
}
