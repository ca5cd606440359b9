package com.example.businessapi.core.auth;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.businessapi.core.CallCancelledException;
import com.example.businessapi.core.CallContext;
import com.example.businessapi.core.errors.AuthenticationException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Caches the access token obtained through a {@link TokenExchanger} and shares it between
 * threads.
 *
 * <p>Reads take the shared lock and return the cached token while it is valid for longer than the
 * skew. Otherwise the caller escalates to the exclusive lock and re-checks; only the caller that
 * still sees no usable token starts an exchange, and every other caller waits for that exchange
 * instead of starting its own. No lock is held while the exchange runs, so at most one exchange is
 * in flight at any time and readers of a valid token are never blocked by network I/O.
 *
 * <pre>{@code
 * var provider = OAuth2TokenProvider.builder()
 *     .exchanger(new HttpTokenExchanger(credential, endpoint, httpClient, null, null, null))
 *     .skew(Duration.ofMinutes(5))
 *     .build();
 * }</pre>
 */
public final class OAuth2TokenProvider implements TokenProvider {

  private static final System.Logger LOGGER =
      System.getLogger(OAuth2TokenProvider.class.getName());

  public static final Duration DEFAULT_SKEW = Duration.ofMinutes(5);

  private final TokenExchanger exchanger;
  private final Clock clock;
  private final Duration skew;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  // guarded by lock
  private Token token;
  private long generation;
  private Exchange inflight;

  private OAuth2TokenProvider(final Builder builder) {
    this.exchanger = builder.exchanger;
    this.clock = builder.clock;
    this.skew = builder.skew;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link OAuth2TokenProvider}. */
  public static class Builder {
    private TokenExchanger exchanger;
    private Clock clock = Clock.systemUTC();
    private Duration skew = DEFAULT_SKEW;

    private Builder() {}

    /**
     * Sets the exchanger performing the network round trip (required).
     *
     * @param exchanger token exchanger
     * @return this builder
     */
    public Builder exchanger(final TokenExchanger exchanger) {
      this.exchanger = exchanger;
      return this;
    }

    /**
     * Sets the clock used for expiry checks.
     *
     * <p>Default: {@link Clock#systemUTC()}
     *
     * @param clock clock
     * @return this builder
     */
    public Builder clock(final Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets how long before its expiry a cached token is considered stale.
     *
     * <p>Default: 5 minutes
     *
     * @param skew refresh margin
     * @return this builder
     */
    public Builder skew(final Duration skew) {
      this.skew = skew;
      return this;
    }

    /**
     * Builds the provider.
     *
     * @return configured provider
     * @throws IllegalStateException if the exchanger is missing
     */
    public OAuth2TokenProvider build() {
      if (exchanger == null) throw new IllegalStateException("exchanger is required");
      if (clock == null) throw new IllegalStateException("clock cannot be null");
      if (skew == null || skew.isNegative())
        throw new IllegalArgumentException("skew must be non-negative");
      return new OAuth2TokenProvider(this);
    }
  }

  @Override
  public Token getToken(final CallContext ctx) {
    ctx.throwIfCancelled();

    lock.readLock().lock();
    try {
      if (usable(token)) return token;
    } finally {
      lock.readLock().unlock();
    }

    return obtain(ctx);
  }

  @Override
  public void forceRefresh(final CallContext ctx) {
    ctx.throwIfCancelled();

    lock.writeLock().lock();
    try {
      token = null;
      generation++;
    } finally {
      lock.writeLock().unlock();
    }

    LOGGER.log(INFO, "Cached access token discarded, requesting a new one");
    obtain(ctx);
  }

  /**
   * @return the cached token, if any, regardless of its validity
   */
  public Optional<Token> cachedToken() {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(token);
    } finally {
      lock.readLock().unlock();
    }
  }

  private Token obtain(final CallContext ctx) {
    while (true) {
      final Exchange exchange;
      final boolean owner;
      final boolean current;

      lock.writeLock().lock();
      try {
        if (usable(token)) return token;
        owner = inflight == null;
        if (owner) inflight = new Exchange(generation, new CompletableFuture<>());
        exchange = inflight;
        current = exchange.generation == generation;
      } finally {
        lock.writeLock().unlock();
      }

      if (owner) return run(ctx, exchange);

      try {
        final var result = ctx.await(exchange.result);
        // an exchange started before the last forced refresh is waited out, not reused
        if (current) {
          LOGGER.log(DEBUG, "Joined in-flight token exchange");
          return result;
        }
      } catch (final ExecutionException e) {
        if (!current || e.getCause() instanceof CallCancelledException) continue;
        throw asAuthenticationFailure(e.getCause());
      }
    }
  }

  private Token run(final CallContext ctx, final Exchange exchange) {
    try {
      final var fresh = exchanger.exchange(ctx);
      lock.writeLock().lock();
      try {
        inflight = null;
        if (exchange.generation == generation) token = fresh;
      } finally {
        lock.writeLock().unlock();
      }
      exchange.result.complete(fresh);
      return fresh;
    } catch (final CallCancelledException e) {
      release();
      // wrapped so waiters see an ExecutionException rather than a cancellation of their own
      exchange.result.completeExceptionally(new CompletionException(e));
      throw e;
    } catch (final RuntimeException e) {
      final var failure = asAuthenticationFailure(e);
      release();
      LOGGER.log(WARNING, "Token exchange failed: {0}", failure.getMessage());
      exchange.result.completeExceptionally(failure);
      throw failure;
    } catch (final Error e) {
      release();
      exchange.result.completeExceptionally(e);
      throw e;
    }
  }

  private void release() {
    lock.writeLock().lock();
    try {
      inflight = null;
    } finally {
      lock.writeLock().unlock();
    }
  }

  private boolean usable(final Token candidate) {
    return candidate != null && candidate.isValid(clock.instant(), skew);
  }

  private static RuntimeException asAuthenticationFailure(final Throwable cause) {
    if (cause instanceof AuthenticationException auth) return auth;
    return new AuthenticationException("Token exchange failed: " + cause.getMessage(), cause);
  }

  private record Exchange(long generation, CompletableFuture<Token> result) {}
}
