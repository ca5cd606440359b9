package com.example.businessapi.core.http;

import com.example.businessapi.core.errors.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of one API call, relative to the client's base URL.
 *
 * <pre>{@code
 * var request = ApiRequest.get("/v1/orgDevices")
 *     .fields("orgDevices", "serialNumber", "deviceModel")
 *     .limit(100)
 *     .build();
 * }</pre>
 *
 * @param method HTTP method, upper case
 * @param path path below the base URL, starting with {@code /}
 * @param query query parameters in insertion order
 * @param headers additional request headers
 * @param body request body, null when there is none
 */
public record ApiRequest(
    String method,
    String path,
    Map<String, String> query,
    Map<String, String> headers,
    byte[] body) {

  public static final int MAX_LIMIT = 1000;

  private static final Set<String> METHODS =
      Set.of("GET", "POST", "PUT", "PATCH", "DELETE", "HEAD", "OPTIONS");

  private static final ObjectMapper MAPPER = new ObjectMapper();

  public ApiRequest {
    if (method == null || !METHODS.contains(method.toUpperCase(Locale.ROOT)))
      throw new ValidationException("Unsupported HTTP method: " + method);
    if (path == null || path.isBlank()) throw new ValidationException("path is required");
    if (!path.startsWith("/")) throw new ValidationException("path must start with '/': " + path);
    if (path.contains("?"))
      throw new ValidationException("query parameters belong in query(), not in the path");
    method = method.toUpperCase(Locale.ROOT);
    query = copy(query, "query parameter");
    headers = copy(headers, "header");
    body = body == null ? null : body.clone();
  }

  private static Map<String, String> copy(final Map<String, String> source, final String what) {
    if (source == null || source.isEmpty()) return Map.of();
    final var copy = new LinkedHashMap<String, String>();
    source.forEach(
        (key, value) -> {
          if (key == null || key.isBlank()) throw new ValidationException(what + " name is blank");
          if (value == null) throw new ValidationException(what + " '" + key + "' has no value");
          copy.put(key, value);
        });
    return Collections.unmodifiableMap(copy);
  }

  public static Builder builder(final String method, final String path) {
    return new Builder(method, path);
  }

  public static Builder get(final String path) {
    return new Builder("GET", path);
  }

  public static Builder post(final String path) {
    return new Builder("POST", path);
  }

  public static Builder put(final String path) {
    return new Builder("PUT", path);
  }

  public static Builder patch(final String path) {
    return new Builder("PATCH", path);
  }

  public static Builder delete(final String path) {
    return new Builder("DELETE", path);
  }

  /**
   * @param newQuery replacement query parameters
   * @return a copy of this request with {@code newQuery} as its query
   */
  public ApiRequest withQuery(final Map<String, String> newQuery) {
    return new ApiRequest(method, path, newQuery, headers, body);
  }

  @Override
  public byte[] body() {
    return body == null ? null : body.clone();
  }

  /**
   * @return {@code METHOD /path}, used in log lines
   */
  public String describe() {
    return method + " " + path;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof ApiRequest other)) return false;
    return method.equals(other.method)
        && path.equals(other.path)
        && query.equals(other.query)
        && headers.equals(other.headers)
        && Arrays.equals(body, other.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(method, path, query, headers, Arrays.hashCode(body));
  }

  @Override
  public String toString() {
    return "ApiRequest[" + describe() + ", query=" + query + "]";
  }

  /** Fluent builder for {@link ApiRequest}. */
  public static class Builder {
    private final String method;
    private final String path;
    private final Map<String, String> query = new LinkedHashMap<>();
    private final Map<String, String> headers = new LinkedHashMap<>();
    private byte[] body;

    private Builder(final String method, final String path) {
      this.method = method;
      this.path = path;
    }

    public Builder query(final String name, final String value) {
      query.put(name, value);
      return this;
    }

    public Builder query(final Map<String, String> values) {
      query.putAll(values);
      return this;
    }

    /**
     * Restricts the attributes returned for a resource type: {@code fields[resource]=a,b,c}.
     *
     * @param resource resource type, e.g. {@code orgDevices}
     * @param names attribute names
     * @return this builder
     */
    public Builder fields(final String resource, final String... names) {
      if (resource == null || resource.isBlank())
        throw new ValidationException("fields resource is required");
      if (names == null || names.length == 0)
        throw new ValidationException("at least one field is required for " + resource);
      query.put("fields[" + resource + "]", String.join(",", names));
      return this;
    }

    /**
     * Sets the page size. Values above {@value ApiRequest#MAX_LIMIT} are lowered to it.
     *
     * @param limit page size, at least 1
     * @return this builder
     */
    public Builder limit(final int limit) {
      if (limit < 1) throw new ValidationException("limit must be >= 1, got " + limit);
      query.put("limit", String.valueOf(Math.min(limit, MAX_LIMIT)));
      return this;
    }

    public Builder cursor(final String cursor) {
      if (cursor == null || cursor.isBlank()) throw new ValidationException("cursor is blank");
      query.put("cursor", cursor);
      return this;
    }

    public Builder header(final String name, final String value) {
      headers.put(name, value);
      return this;
    }

    public Builder body(final byte[] content, final String contentType) {
      this.body = content;
      headers.put("Content-Type", contentType);
      return this;
    }

    /**
     * Serializes {@code payload} with Jackson and sends it as {@code application/json}.
     *
     * @param payload request document
     * @return this builder
     */
    public Builder jsonBody(final Object payload) {
      try {
        return body(MAPPER.writeValueAsBytes(payload), "application/json");
      } catch (final JsonProcessingException e) {
        throw new ValidationException("Request body is not serializable: " + e.getMessage(), e);
      }
    }

    public ApiRequest build() {
      return new ApiRequest(method, path, query, headers, body);
    }
  }
}
