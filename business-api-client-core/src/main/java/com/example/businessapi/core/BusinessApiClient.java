package com.example.businessapi.core;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.businessapi.core.auth.ClientAssertionFactory;
import com.example.businessapi.core.auth.Credential;
import com.example.businessapi.core.auth.HttpTokenExchanger;
import com.example.businessapi.core.auth.OAuth2TokenProvider;
import com.example.businessapi.core.auth.PrivateKeys;
import com.example.businessapi.core.auth.TokenProvider;
import com.example.businessapi.core.errors.ApiClientException;
import com.example.businessapi.core.errors.ValidationException;
import com.example.businessapi.core.http.ApacheRequestSender;
import com.example.businessapi.core.http.ApiRequest;
import com.example.businessapi.core.http.ApiResponse;
import com.example.businessapi.core.http.Retry;
import com.example.businessapi.core.http.RetryableTransport;
import com.example.businessapi.core.pagination.PageConsumer;
import com.example.businessapi.core.pagination.PaginationWalker;
import com.example.businessapi.core.secrets.SecretHelper;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;

/**
 * Client for the Business/School Manager REST API: authenticates, retries and paginates.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var client = BusinessApiClient.builder()
 *     .credential(Credential.of(keyId, issuerId, PrivateKeys.fromFile(Path.of("key.p8"))))
 *     .build();
 *
 * var devices = client.collectAll(
 *     CallContext.background(),
 *     ApiRequest.get("/v1/orgDevices").limit(1000).build(),
 *     OrgDevice.class);
 * }</pre>
 *
 * <h2>From Environment</h2>
 *
 * <pre>{@code
 * // APPLE_KEY_ID, APPLE_ISSUER_ID, APPLE_PRIVATE_KEY_PATH
 * try (var client = BusinessApiClient.fromEnvironment()) {
 *   var response = client.execute(ctx, ApiRequest.get("/v1/mdmServers").build());
 * }
 * }</pre>
 *
 * <h2>From AWS Secrets Manager</h2>
 *
 * <pre>{@code
 * var client = BusinessApiClient.fromSecretsManager("prod/business-api");
 * }</pre>
 *
 * <h2>Full Configuration</h2>
 *
 * <pre>{@code
 * var client = BusinessApiClient.builder()
 *     .credential(credential)
 *     .baseUrl(URI.create("https://api-school.apple.com"))
 *     .retryPolicy(Retry.Policy.exponential(5, 500L, 20_000L))
 *     .requestTimeout(Duration.ofSeconds(60))
 *     .tokenSkew(Duration.ofMinutes(10))
 *     .maxPages(500)
 *     .userAgent("inventory-sync/2.3")
 *     .build();
 * }</pre>
 */
public final class BusinessApiClient implements AutoCloseable {

  private static final System.Logger LOGGER = System.getLogger(BusinessApiClient.class.getName());

  public static final URI DEFAULT_BASE_URL = URI.create("https://api-business.apple.com");
  public static final URI DEFAULT_TOKEN_ENDPOINT =
      URI.create(HttpTokenExchanger.DEFAULT_TOKEN_ENDPOINT);
  public static final String DEFAULT_USER_AGENT = "business-api-client/1.0.0";
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  private final CloseableHttpClient httpClient;
  private final boolean ownsHttpClient;
  private final ObjectMapper mapper;
  private final TokenProvider tokenProvider;
  private final RetryableTransport transport;
  private final PaginationWalker walker;

  private BusinessApiClient(final Builder builder) {
    this.ownsHttpClient = builder.httpClient == null;
    this.httpClient =
        ownsHttpClient
            ? HttpClients.custom().disableAutomaticRetries().build()
            : builder.httpClient;
    this.mapper = builder.mapper;

    this.tokenProvider =
        OAuth2TokenProvider.builder()
            .exchanger(
                new HttpTokenExchanger(
                    builder.credential,
                    builder.tokenEndpoint,
                    httpClient,
                    new ClientAssertionFactory(builder.clock, ClientAssertionFactory.MAX_LIFETIME),
                    mapper,
                    builder.clock))
            .clock(builder.clock)
            .skew(builder.tokenSkew)
            .build();

    this.transport =
        RetryableTransport.builder()
            .tokenProvider(tokenProvider)
            .sender(
                new ApacheRequestSender(
                    httpClient, builder.baseUrl, builder.userAgent, builder.requestTimeout))
            .retryPolicy(builder.retryPolicy)
            .clock(builder.clock)
            .build();

    this.walker = new PaginationWalker(transport, mapper, builder.maxPages);

    LOGGER.log(
        INFO,
        "Business API client created for {0} (scope {1}) against {2}",
        builder.credential.issuerId(),
        builder.credential.scope(),
        builder.baseUrl);
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds a client from {@code APPLE_KEY_ID}, {@code APPLE_ISSUER_ID} and {@code
   * APPLE_PRIVATE_KEY_PATH} (or the matching system properties, see {@link Settings}).
   *
   * @return configured client
   * @throws ValidationException if a required setting is missing or the key cannot be loaded
   */
  public static BusinessApiClient fromEnvironment() {
    final var keyId = require(Settings.KEY_ID);
    final var issuerId = require(Settings.ISSUER_ID);
    final var keyPath = require(Settings.PRIVATE_KEY_PATH);
    final var scope = Settings.lookup(Settings.SCOPE).orElse(null);

    final var credential =
        new Credential(keyId, issuerId, PrivateKeys.fromFile(Path.of(keyPath)), scope, null);
    return environmentDefaults(builder().credential(credential)).build();
  }

  /**
   * Builds a client whose credential is stored in AWS Secrets Manager as a JSON document {@code
   * {keyId, issuerId, privateKey, scope}}.
   *
   * @param secretId secret name or ARN
   * @return configured client
   */
  public static BusinessApiClient fromSecretsManager(final String secretId) {
    return environmentDefaults(builder().credential(SecretHelper.getCredential(secretId))).build();
  }

  private static Builder environmentDefaults(final Builder builder) {
    Settings.lookup(Settings.BASE_URL).map(URI::create).ifPresent(builder::baseUrl);
    Settings.lookupSeconds(Settings.TIMEOUT_SECONDS).ifPresent(builder::requestTimeout);
    return builder;
  }

  private static String require(final String property) {
    return Settings.lookup(property)
        .orElseThrow(
            () ->
                new ValidationException(
                    "Missing setting " + property + " / " + Settings.envName(property)));
  }

  /**
   * Builder for creating {@link BusinessApiClient} instances with fluent configuration.
   *
   * <p>Only the credential is required.
   */
  public static class Builder {
    private Credential credential;
    private URI baseUrl = DEFAULT_BASE_URL;
    private URI tokenEndpoint = DEFAULT_TOKEN_ENDPOINT;
    private Retry.Policy retryPolicy = Retry.Policy.defaults();
    private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
    private Duration tokenSkew = OAuth2TokenProvider.DEFAULT_SKEW;
    private int maxPages = PaginationWalker.DEFAULT_MAX_PAGES;
    private String userAgent = DEFAULT_USER_AGENT;
    private CloseableHttpClient httpClient;
    private ObjectMapper mapper =
        new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    /**
     * Sets the API credential (required).
     *
     * @param credential key id, issuer id and signing key
     * @return this builder
     */
    public Builder credential(final Credential credential) {
      this.credential = credential;
      return this;
    }

    /**
     * Sets the API base URL.
     *
     * <p>Default: {@code https://api-business.apple.com}
     *
     * @param baseUrl scheme and host of the API
     * @return this builder
     */
    public Builder baseUrl(final URI baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    /**
     * Sets the OAuth2 token endpoint.
     *
     * <p>Default: {@code https://account.apple.com/auth/oauth2/v2/token}
     *
     * @param tokenEndpoint token endpoint URL
     * @return this builder
     */
    public Builder tokenEndpoint(final URI tokenEndpoint) {
      this.tokenEndpoint = tokenEndpoint;
      return this;
    }

    /**
     * Sets the retry policy.
     *
     * <p>Default: 3 retries, backoff doubling from 1 to 10 seconds
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(final Retry.Policy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the response timeout of a single HTTP exchange.
     *
     * <p>Default: 30 seconds
     *
     * @param requestTimeout per-request timeout
     * @return this builder
     */
    public Builder requestTimeout(final Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    /**
     * Sets how long before expiry a cached token is refreshed.
     *
     * <p>Default: 5 minutes
     *
     * @param tokenSkew refresh margin
     * @return this builder
     */
    public Builder tokenSkew(final Duration tokenSkew) {
      this.tokenSkew = tokenSkew;
      return this;
    }

    /**
     * Sets the maximum number of pages a single walk may fetch.
     *
     * <p>Default: 10,000
     *
     * @param maxPages page cap
     * @return this builder
     */
    public Builder maxPages(final int maxPages) {
      this.maxPages = maxPages;
      return this;
    }

    public Builder userAgent(final String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    /**
     * Uses a caller-owned HTTP client, left open by {@link BusinessApiClient#close()}. It should
     * not retry on its own.
     *
     * @param httpClient HTTP client
     * @return this builder
     */
    public Builder httpClient(final CloseableHttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    public Builder objectMapper(final ObjectMapper mapper) {
      this.mapper = mapper;
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the client.
     *
     * @return configured client
     * @throws IllegalStateException if required fields are not set
     */
    public BusinessApiClient build() {
      if (credential == null) throw new IllegalStateException("credential is required");
      if (baseUrl == null) throw new IllegalStateException("baseUrl cannot be null");
      if (tokenEndpoint == null) throw new IllegalStateException("tokenEndpoint cannot be null");
      if (retryPolicy == null) throw new IllegalStateException("retryPolicy cannot be null");
      if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero())
        throw new IllegalArgumentException("requestTimeout must be positive");
      if (tokenSkew == null || tokenSkew.isNegative())
        throw new IllegalArgumentException("tokenSkew must be non-negative");
      if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
      if (userAgent == null || userAgent.isBlank())
        throw new IllegalArgumentException("userAgent must not be blank");
      if (mapper == null) throw new IllegalStateException("objectMapper cannot be null");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      return new BusinessApiClient(this);
    }
  }

  /**
   * Executes a request and returns the raw 2xx response.
   *
   * @param ctx cancellation scope
   * @param request request to execute
   * @return successful response
   */
  public ApiResponse execute(final CallContext ctx, final ApiRequest request) {
    return transport.execute(ctx, request);
  }

  /**
   * Executes a request and maps its JSON body with Jackson.
   *
   * @param ctx cancellation scope
   * @param request request to execute
   * @param type target type
   * @param <T> target type
   * @return decoded body
   * @throws ApiClientException if the body cannot be decoded
   */
  public <T> T execute(final CallContext ctx, final ApiRequest request, final Class<T> type) {
    final var response = transport.execute(ctx, request);
    try {
      return mapper.readValue(response.body(), type);
    } catch (final IOException e) {
      throw new ApiClientException(
          "Cannot decode " + request.describe() + " response as " + type.getSimpleName(), e);
    }
  }

  /**
   * Walks every page of a paginated collection.
   *
   * @param ctx cancellation scope of the whole walk
   * @param request first page request
   * @param consumer receives each raw page body
   * @param <E> exception type of the consumer
   * @return number of pages consumed
   * @throws E as thrown by the consumer
   */
  public <E extends Exception> int walk(
      final CallContext ctx, final ApiRequest request, final PageConsumer<E> consumer) throws E {
    return walker.walk(ctx, request, consumer);
  }

  /**
   * Walks every page and returns the elements of all {@code data} arrays.
   *
   * @param ctx cancellation scope of the whole walk
   * @param request first page request
   * @param itemType element type
   * @param <T> element type
   * @return all elements in page order
   */
  public <T> List<T> collectAll(
      final CallContext ctx, final ApiRequest request, final Class<T> itemType) {
    return walker.collectAll(ctx, request, itemType);
  }

  public TokenProvider tokenProvider() {
    return tokenProvider;
  }

  /** Closes the HTTP client unless it was supplied by the caller. */
  @Override
  public void close() {
    if (!ownsHttpClient) return;
    try {
      httpClient.close();
    } catch (final IOException e) {
      LOGGER.log(WARNING, "Failed to close HTTP client", e);
    }
  }
}
