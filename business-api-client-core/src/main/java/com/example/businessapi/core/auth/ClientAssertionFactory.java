package com.example.businessapi.core.auth;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.businessapi.core.errors.AuthenticationException;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.time.Clock;
import java.time.Duration;
import java.util.Date;
import java.util.UUID;

/**
 * Signs the JWT client assertion presented to the token endpoint.
 *
 * <p>Header: {@code alg} from the key variant and {@code kid}. Claims: {@code iss} and {@code sub}
 * set to the client identity, {@code aud}, {@code iat}, {@code exp} and a random {@code jti}.
 */
public final class ClientAssertionFactory {

  private static final System.Logger LOGGER =
      System.getLogger(ClientAssertionFactory.class.getName());

  /** Longest assertion lifetime the authorization server accepts. */
  public static final Duration MAX_LIFETIME = Duration.ofDays(180);

  private final Clock clock;
  private final Duration lifetime;

  public ClientAssertionFactory() {
    this(Clock.systemUTC(), MAX_LIFETIME);
  }

  public ClientAssertionFactory(final Clock clock, final Duration lifetime) {
    if (clock == null) throw new IllegalArgumentException("clock is required");
    if (lifetime == null || lifetime.isNegative() || lifetime.isZero())
      throw new IllegalArgumentException("lifetime must be positive");
    if (lifetime.compareTo(MAX_LIFETIME) > 0)
      throw new IllegalArgumentException("lifetime must not exceed " + MAX_LIFETIME);
    this.clock = clock;
    this.lifetime = lifetime;
  }

  /**
   * Builds and signs an assertion.
   *
   * @param credential identity and signing key
   * @param audience {@code aud} claim value
   * @return compact serialized JWT
   * @throws AuthenticationException if signing fails
   */
  public String create(final Credential credential, final String audience) {
    final var now = clock.instant();
    final var key = credential.signingKey();

    final var header = new JWSHeader.Builder(key.algorithm()).keyID(credential.keyId()).build();
    final var claims =
        new JWTClaimsSet.Builder()
            .issuer(credential.issuerId())
            .subject(credential.issuerId())
            .audience(audience)
            .issueTime(Date.from(now))
            .expirationTime(Date.from(now.plus(lifetime)))
            .jwtID(UUID.randomUUID().toString())
            .build();

    try {
      final var jwt = new SignedJWT(header, claims);
      jwt.sign(key.signer());
      LOGGER.log(
          DEBUG,
          "Signed client assertion kid={0} alg={1} aud={2}",
          credential.keyId(),
          key.algorithm(),
          audience);
      return jwt.serialize();
    } catch (final JOSEException e) {
      throw new AuthenticationException("Failed to sign client assertion: " + e.getMessage(), e);
    }
  }
}
