package com.example.businessapi.core.http;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.businessapi.core.CallContext;
import com.example.businessapi.core.errors.ValidationException;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.LinkedHashMap;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.net.URIBuilder;
import org.apache.hc.core5.util.Timeout;

/** {@link RequestSender} backed by Apache HttpClient 5. */
public final class ApacheRequestSender implements RequestSender {

  private static final System.Logger LOGGER =
      System.getLogger(ApacheRequestSender.class.getName());

  private final CloseableHttpClient httpClient;
  private final String baseUrl;
  private final String userAgent;
  private final RequestConfig requestConfig;

  /**
   * @param httpClient client executing the exchanges, owned by the caller
   * @param baseUrl scheme and host of the API, e.g. {@code https://api-business.apple.com}
   * @param userAgent value of the {@code User-Agent} header
   * @param requestTimeout time allowed for the response of a single exchange
   */
  public ApacheRequestSender(
      final CloseableHttpClient httpClient,
      final URI baseUrl,
      final String userAgent,
      final Duration requestTimeout) {
    if (httpClient == null) throw new IllegalArgumentException("httpClient is required");
    if (baseUrl == null || baseUrl.getScheme() == null || baseUrl.getHost() == null)
      throw new IllegalArgumentException("baseUrl must be absolute: " + baseUrl);
    if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero())
      throw new IllegalArgumentException("requestTimeout must be positive");
    this.httpClient = httpClient;
    this.baseUrl = stripTrailingSlash(baseUrl.toString());
    this.userAgent = userAgent;
    this.requestConfig =
        RequestConfig.custom()
            .setResponseTimeout(Timeout.ofMilliseconds(requestTimeout.toMillis()))
            .build();
  }

  @Override
  public ApiResponse send(final CallContext ctx, final ApiRequest request, final String bearerToken)
      throws IOException {
    ctx.throwIfCancelled();

    final var httpRequest = new HttpUriRequestBase(request.method(), resolve(request));
    httpRequest.setConfig(requestConfig);
    httpRequest.setHeader(HttpHeaders.ACCEPT, "application/json");
    if (userAgent != null) httpRequest.setHeader(HttpHeaders.USER_AGENT, userAgent);
    request.headers().forEach(httpRequest::setHeader);
    httpRequest.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken);

    final var body = request.body();
    if (body != null) {
      final var contentType =
          request.headers().getOrDefault("Content-Type", ContentType.APPLICATION_JSON.toString());
      httpRequest.setEntity(new ByteArrayEntity(body, ContentType.parse(contentType)));
    }

    LOGGER.log(DEBUG, "Sending {0} {1}", request.method(), httpRequest.getRequestUri());
    try (var ignored = ctx.onCancel(httpRequest::cancel)) {
      return httpClient.execute(httpRequest, ApacheRequestSender::toResponse);
    }
  }

  URI resolve(final ApiRequest request) {
    try {
      final var builder = new URIBuilder(baseUrl + request.path());
      request.query().forEach(builder::addParameter);
      return builder.build();
    } catch (final URISyntaxException e) {
      throw new ValidationException("Invalid request URI for " + request.describe(), e);
    }
  }

  private static ApiResponse toResponse(final ClassicHttpResponse response) throws IOException {
    final var headers = new LinkedHashMap<String, String>();
    for (final var header : response.getHeaders())
      headers.putIfAbsent(header.getName(), header.getValue());
    final var entity = response.getEntity();
    final var body = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
    return new ApiResponse(response.getCode(), headers, body);
  }

  private static String stripTrailingSlash(final String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
