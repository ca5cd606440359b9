package com.example.businessapi.core.http;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry settings and status rules used by {@link RetryableTransport}.
 *
 * <ul>
 *   <li>429 is retried, honouring {@code Retry-After} when present
 *   <li>5xx is retried, except 501 which will not change on retry
 *   <li>every other status is final
 * </ul>
 */
public final class Retry {

  /** Longest {@code Retry-After} delay honoured; larger values are clamped to it. */
  public static final Duration MAX_RETRY_AFTER = Duration.ofMillis(Long.MAX_VALUE);

  private Retry() {}

  /**
   * Retry policy supporting exponential backoff.
   *
   * @param retryCount retries after the first attempt, must be >= 0
   * @param minWaitMillis delay before the first retry, must be >= 0
   * @param maxWaitMillis upper bound of any backoff delay, must be >= minWaitMillis
   * @param backoffMultiplier growth factor between retries (1.0 = fixed delay), must be >= 1.0
   * @param jitter whether to add random jitter (up to 25%, still capped at maxWaitMillis)
   * @param retryNetworkErrors whether failures without a response are retried
   */
  public record Policy(
      int retryCount,
      long minWaitMillis,
      long maxWaitMillis,
      double backoffMultiplier,
      boolean jitter,
      boolean retryNetworkErrors) {

    public Policy {
      if (retryCount < 0) throw new IllegalArgumentException("retryCount must be >= 0");
      if (minWaitMillis < 0) throw new IllegalArgumentException("minWaitMillis must be >= 0");
      if (maxWaitMillis < minWaitMillis)
        throw new IllegalArgumentException("maxWaitMillis must be >= minWaitMillis");
      if (backoffMultiplier < 1.0)
        throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
    }

    /**
     * Three retries doubling from one to at most ten seconds, with jitter.
     *
     * @return default policy
     */
    public static Policy defaults() {
      return exponential(3, 1_000L, 10_000L);
    }

    /**
     * @param retryCount retries after the first attempt
     * @param minWaitMillis delay before the first retry
     * @param maxWaitMillis delay cap
     * @return doubling backoff policy with jitter that retries network errors
     */
    public static Policy exponential(
        final int retryCount, final long minWaitMillis, final long maxWaitMillis) {
      return new Policy(retryCount, minWaitMillis, maxWaitMillis, 2.0, true, true);
    }

    /**
     * @param retryCount retries after the first attempt
     * @param delayMillis delay between attempts
     * @return fixed delay policy without jitter
     */
    public static Policy fixed(final int retryCount, final long delayMillis) {
      return new Policy(retryCount, delayMillis, delayMillis, 1.0, false, true);
    }

    /**
     * @return policy making a single attempt
     */
    public static Policy none() {
      return new Policy(0, 0L, 0L, 1.0, false, false);
    }

    public Policy withJitter(final boolean enabled) {
      return new Policy(
          retryCount, minWaitMillis, maxWaitMillis, backoffMultiplier, enabled, retryNetworkErrors);
    }

    public Policy withNetworkRetries(final boolean enabled) {
      return new Policy(
          retryCount, minWaitMillis, maxWaitMillis, backoffMultiplier, jitter, enabled);
    }

    /**
     * @return total attempts allowed, the first one included
     */
    public int maxAttempts() {
      return retryCount + 1;
    }

    /**
     * Calculates the backoff before a retry.
     *
     * @param retry retry number (1-based)
     * @return delay in milliseconds
     */
    public long calculateDelay(final int retry) {
      if (retry < 1) return 0L;

      var delay = minWaitMillis;
      if (backoffMultiplier > 1.0) {
        final var grown = minWaitMillis * Math.pow(backoffMultiplier, retry - 1);
        delay = (long) Math.min(grown, maxWaitMillis);
      }

      if (jitter && delay > 0) {
        final var jitterAmount = (long) (delay * 0.25 * ThreadLocalRandom.current().nextDouble());
        delay = Math.min(delay + jitterAmount, maxWaitMillis);
      }

      return delay;
    }
  }

  /**
   * @param status HTTP status code
   * @return true for 429 and for 5xx other than 501
   */
  public static boolean isRetryableStatus(final int status) {
    return status == 429 || (status >= 500 && status <= 599 && status != 501);
  }

  private static Duration capped(final Duration delay) {
    return delay.compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : delay;
  }

  /**
   * Parses a {@code Retry-After} value given either as delta-seconds or as an HTTP-date.
   *
   * @param value header value, may be null
   * @param clock clock used to turn an HTTP-date into a delay
   * @return the requested delay, never negative and at most {@link #MAX_RETRY_AFTER}; empty if
   *     absent or unparsable
   */
  public static Optional<Duration> parseRetryAfter(final String value, final Clock clock) {
    if (value == null || value.isBlank()) return Optional.empty();
    final var trimmed = value.strip();

    if (trimmed.chars().allMatch(Character::isDigit)) {
      try {
        return Optional.of(capped(Duration.ofSeconds(Long.parseLong(trimmed))));
      } catch (final NumberFormatException | ArithmeticException e) {
        return Optional.of(MAX_RETRY_AFTER);
      }
    }

    try {
      final var at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
      final var delay = Duration.between(clock.instant(), at.toInstant());
      return Optional.of(delay.isNegative() ? Duration.ZERO : capped(delay));
    } catch (final DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
