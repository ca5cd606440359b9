package com.example.businessapi.core.http;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Raw response of one HTTP exchange.
 *
 * @param status HTTP status code
 * @param headers response headers, first value per name, case-insensitive lookup
 * @param body response body, empty when there was none
 */
public record ApiResponse(int status, Map<String, String> headers, byte[] body) {

  public ApiResponse {
    final var copy = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
    if (headers != null) headers.forEach(copy::putIfAbsent);
    headers = Collections.unmodifiableMap(copy);
    body = body == null ? new byte[0] : body.clone();
  }

  /**
   * @return a copy of the response body
   */
  @Override
  public byte[] body() {
    return body.clone();
  }

  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }

  public Optional<String> header(final String name) {
    return Optional.ofNullable(headers.get(name));
  }

  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "ApiResponse[status=" + status + ", bytes=" + body.length + "]";
  }
}
