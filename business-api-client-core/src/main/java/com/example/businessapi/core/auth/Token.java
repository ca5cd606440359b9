package com.example.businessapi.core.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * OAuth2 access token with its absolute expiry.
 *
 * @param accessToken bearer token value, never blank
 * @param expiresAt instant after which the token is rejected
 * @param scope scope granted by the server, may be null
 */
public record Token(String accessToken, Instant expiresAt, String scope) {

  public Token {
    if (accessToken == null || accessToken.isBlank())
      throw new IllegalArgumentException("accessToken must not be blank");
    if (expiresAt == null) throw new IllegalArgumentException("expiresAt is required");
  }

  /**
   * @param now current time
   * @param skew safety margin subtracted from the expiry
   * @return true if the token is still usable at {@code now}
   */
  public boolean isValid(final Instant now, final Duration skew) {
    return now.isBefore(expiresAt.minus(skew));
  }

  @Override
  public String toString() {
    return "Token[expiresAt=" + expiresAt + ", scope=" + scope + "]";
  }
}
