package com.example.businessapi.core.auth;

import com.example.businessapi.core.errors.ValidationException;

/**
 * Immutable API credential: the key identifier, the client identity the assertion is issued for
 * and the key that signs it.
 *
 * @param keyId identifier of the signing key, sent as the JWT {@code kid} header
 * @param issuerId client identity, sent as {@code iss}, {@code sub} and {@code client_id}
 * @param signingKey key and algorithm used to sign the assertion
 * @param scope OAuth2 scope to request, {@link #SCOPE_BUSINESS} when null
 * @param audience assertion {@code aud} claim, the token endpoint when null
 */
public record Credential(
    String keyId, String issuerId, SigningKey signingKey, String scope, String audience) {

  public static final String SCOPE_BUSINESS = "business.api";
  public static final String SCOPE_SCHOOL = "school.api";

  public Credential {
    if (keyId == null || keyId.isBlank()) throw new ValidationException("keyId is required");
    if (issuerId == null || issuerId.isBlank())
      throw new ValidationException("issuerId is required");
    if (signingKey == null) throw new ValidationException("signingKey is required");
    scope = scope == null || scope.isBlank() ? SCOPE_BUSINESS : scope.strip();
    audience = audience == null || audience.isBlank() ? null : audience.strip();
    keyId = keyId.strip();
    issuerId = issuerId.strip();
  }

  /**
   * Credential for the business scope whose assertion audience is the token endpoint.
   *
   * @param keyId signing key identifier
   * @param issuerId client identity
   * @param signingKey signing key
   * @return credential
   */
  public static Credential of(
      final String keyId, final String issuerId, final SigningKey signingKey) {
    return new Credential(keyId, issuerId, signingKey, null, null);
  }

  /**
   * @param scope scope to request instead of the current one
   * @return a copy with the given scope
   */
  public Credential withScope(final String scope) {
    return new Credential(keyId, issuerId, signingKey, scope, audience);
  }
}
