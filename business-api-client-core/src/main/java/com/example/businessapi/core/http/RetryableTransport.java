package com.example.businessapi.core.http;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.businessapi.core.CallCancelledException;
import com.example.businessapi.core.CallContext;
import com.example.businessapi.core.auth.TokenProvider;
import com.example.businessapi.core.errors.ErrorClassifier;
import com.example.businessapi.core.errors.NetworkException;
import com.example.businessapi.core.http.Retry.Policy;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Authenticated request execution with retry.
 *
 * <p>Every attempt carries a bearer token from the {@link TokenProvider}. A 401 triggers one
 * forced token refresh followed by an immediate retry. 429 and 5xx (except 501) responses and,
 * when the policy allows it, network failures are retried after a backoff; a 429 waits for its
 * {@code Retry-After} instead when the header is present. All retries, the 401 refresh included,
 * draw on the same budget of {@link Policy#maxAttempts()} attempts. A response that is not retried
 * is turned into an exception by the {@link ErrorClassifier}.
 *
 * <pre>{@code
 * var transport = RetryableTransport.builder()
 *     .tokenProvider(provider)
 *     .sender(new ApacheRequestSender(httpClient, baseUrl, "my-app/1.0", Duration.ofSeconds(30)))
 *     .retryPolicy(Retry.Policy.exponential(5, 500L, 10_000L))
 *     .build();
 * }</pre>
 */
public final class RetryableTransport implements Transport {

  private static final System.Logger LOGGER = System.getLogger(RetryableTransport.class.getName());

  private final TokenProvider tokenProvider;
  private final RequestSender sender;
  private final Policy policy;
  private final ErrorClassifier classifier;
  private final Clock clock;

  private RetryableTransport(final Builder builder) {
    this.tokenProvider = builder.tokenProvider;
    this.sender = builder.sender;
    this.policy = builder.retryPolicy;
    this.classifier = builder.classifier;
    this.clock = builder.clock;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link RetryableTransport}. */
  public static class Builder {
    private TokenProvider tokenProvider;
    private RequestSender sender;
    private Policy retryPolicy = Policy.defaults();
    private ErrorClassifier classifier = new ErrorClassifier();
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    /**
     * Sets the token source (required).
     *
     * @param tokenProvider token provider
     * @return this builder
     */
    public Builder tokenProvider(final TokenProvider tokenProvider) {
      this.tokenProvider = tokenProvider;
      return this;
    }

    /**
     * Sets the sender performing single exchanges (required).
     *
     * @param sender request sender
     * @return this builder
     */
    public Builder sender(final RequestSender sender) {
      this.sender = sender;
      return this;
    }

    /**
     * Sets the retry policy.
     *
     * <p>Default: {@link Policy#defaults()}
     *
     * @param retryPolicy retry policy
     * @return this builder
     */
    public Builder retryPolicy(final Policy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder classifier(final ErrorClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    /**
     * Sets the clock used to evaluate HTTP-date {@code Retry-After} values.
     *
     * @param clock clock
     * @return this builder
     */
    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    public RetryableTransport build() {
      if (tokenProvider == null) throw new IllegalStateException("tokenProvider is required");
      if (sender == null) throw new IllegalStateException("sender is required");
      if (retryPolicy == null) throw new IllegalStateException("retryPolicy cannot be null");
      if (classifier == null) throw new IllegalStateException("classifier cannot be null");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      return new RetryableTransport(this);
    }
  }

  public Policy retryPolicy() {
    return policy;
  }

  /**
   * Executes {@code request}, retrying as described on the class.
   *
   * @param ctx cancellation scope covering every attempt and backoff wait
   * @param request request to execute
   * @return the first 2xx response
   * @throws com.example.businessapi.core.errors.HttpStatusException for a final non-2xx response
   * @throws NetworkException if the last attempt produced no response
   * @throws com.example.businessapi.core.errors.AuthenticationException if no token can be
   *     obtained
   * @throws CallCancelledException if {@code ctx} is cancelled
   */
  @Override
  public ApiResponse execute(final CallContext ctx, final ApiRequest request) {
    final var maxAttempts = policy.maxAttempts();
    var refreshed = false;
    var backoffs = 0;

    for (var attempt = 1; ; attempt++) {
      ctx.throwIfCancelled();
      final var token = tokenProvider.getToken(ctx);

      final ApiResponse response;
      try {
        response = sender.send(ctx, request, token.accessToken());
      } catch (final IOException e) {
        if (ctx.isCancelled() || Thread.currentThread().isInterrupted())
          throw new CallCancelledException(
              ctx.cancellationReason().orElse("thread interrupted"), e);

        final var failure =
            new NetworkException(request.describe() + " failed: " + e.getMessage(), e);
        if (!policy.retryNetworkErrors() || attempt >= maxAttempts) {
          LOGGER.log(WARNING, "{0} failed after {1} attempt(s)", request.describe(), attempt);
          throw failure;
        }
        backoffs++;
        final var delay = Duration.ofMillis(policy.calculateDelay(backoffs));
        logRetry(request, attempt, maxAttempts, delay, "network error: " + e.getMessage());
        ctx.sleep(delay);
        continue;
      }

      if (response.isSuccess()) {
        LOGGER.log(DEBUG, "{0} -> {1}", request.describe(), response.status());
        return response;
      }

      final var status = response.status();
      if (status == 401 && !refreshed && attempt < maxAttempts) {
        refreshed = true;
        logRetry(request, attempt, maxAttempts, Duration.ZERO, "401, refreshing access token");
        tokenProvider.forceRefresh(ctx);
        continue;
      }

      if (!Retry.isRetryableStatus(status) || attempt >= maxAttempts) {
        throw classifier.classify(status, response.body(), request.describe());
      }

      backoffs++;
      final var backoff = Duration.ofMillis(policy.calculateDelay(backoffs));
      final var delay =
          status == 429
              ? Retry.parseRetryAfter(response.header("Retry-After").orElse(null), clock)
                  .orElse(backoff)
              : backoff;
      logRetry(request, attempt, maxAttempts, delay, "status " + status);
      ctx.sleep(delay);
    }
  }

  private static void logRetry(
      final ApiRequest request,
      final int attempt,
      final int maxAttempts,
      final Duration delay,
      final String reason) {
    LOGGER.log(
        WARNING,
        "Retrying {0} after {1} ms (attempt {2}/{3}): {4}",
        request.describe(),
        delay.toMillis(),
        attempt + 1,
        maxAttempts,
        reason);
  }
}
