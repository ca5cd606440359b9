package com.example.businessapi.core.errors;

import java.util.Locale;
import java.util.Optional;
import org.apache.hc.core5.http.impl.EnglishReasonPhraseCatalog;

/**
 * Non-2xx response whose body carried no structured error envelope.
 *
 * <p>Carries the status code and at most {@value #MAX_SNIPPET} characters of the body.
 */
public class HttpStatusException extends ApiClientException {

  public static final int MAX_SNIPPET = 512;

  private final int status;
  private final String bodySnippet;

  public HttpStatusException(final int status, final String body) {
    this(status, body, describe(status, snippet(body)));
  }

  protected HttpStatusException(final int status, final String body, final String message) {
    super(message);
    this.status = status;
    this.bodySnippet = snippet(body);
  }

  /**
   * @return HTTP status code of the response
   */
  public int status() {
    return status;
  }

  /**
   * @return leading part of the response body, empty when there was none
   */
  public String bodySnippet() {
    return bodySnippet;
  }

  /**
   * @return synthetic error code {@code HTTP_<status>}
   */
  public String code() {
    return "HTTP_" + status;
  }

  /**
   * @return standard reason phrase of the status, e.g. {@code Service Unavailable}
   */
  public String reasonPhrase() {
    return reasonPhrase(status);
  }

  static String reasonPhrase(final int status) {
    if (status < 100 || status > 599) return "Unknown Status";
    return Optional.ofNullable(EnglishReasonPhraseCatalog.INSTANCE.getReason(status, Locale.ROOT))
        .orElse("Unknown Status");
  }

  private static String describe(final int status, final String snippet) {
    final var base = "HTTP " + status + " " + reasonPhrase(status);
    return snippet.isBlank() ? base : base + ": " + snippet;
  }

  static String snippet(final String body) {
    if (body == null) return "";
    final var trimmed = body.strip();
    return trimmed.length() <= MAX_SNIPPET ? trimmed : trimmed.substring(0, MAX_SNIPPET) + "...";
  }
}
