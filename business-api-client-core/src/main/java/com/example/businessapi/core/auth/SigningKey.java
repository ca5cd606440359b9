package com.example.businessapi.core.auth;

import com.example.businessapi.core.errors.ValidationException;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.Curve;
import java.security.PrivateKey;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.RSAPrivateKey;

/**
 * Private key used to sign client assertions, paired with the JWS algorithm it implies.
 *
 * <p>Only two variants exist: a P-256 elliptic-curve key signs with ES256, an RSA key of at least
 * {@value #MIN_RSA_BITS} bits signs with RS256.
 */
public final class SigningKey {

  public static final int MIN_RSA_BITS = 2048;

  /** Key family. */
  public enum Kind {
    ELLIPTIC_CURVE(JWSAlgorithm.ES256),
    RSA(JWSAlgorithm.RS256);

    private final JWSAlgorithm algorithm;

    Kind(final JWSAlgorithm algorithm) {
      this.algorithm = algorithm;
    }

    public JWSAlgorithm algorithm() {
      return algorithm;
    }
  }

  private final Kind kind;
  private final PrivateKey key;

  private SigningKey(final Kind kind, final PrivateKey key) {
    this.kind = kind;
    this.key = key;
  }

  /**
   * Wraps a P-256 elliptic-curve key.
   *
   * @param key EC private key on the P-256 curve
   * @return ES256 signing key
   * @throws ValidationException if the key is null or on another curve
   */
  public static SigningKey elliptic(final ECPrivateKey key) {
    if (key == null) throw new ValidationException("signing key is required");
    if (!Curve.P_256.equals(Curve.forECParameterSpec(key.getParams())))
      throw new ValidationException("ES256 requires a P-256 elliptic-curve key");
    return new SigningKey(Kind.ELLIPTIC_CURVE, key);
  }

  /**
   * Wraps an RSA key.
   *
   * @param key RSA private key of at least 2048 bits
   * @return RS256 signing key
   * @throws ValidationException if the key is null or too short
   */
  public static SigningKey rsa(final RSAPrivateKey key) {
    if (key == null) throw new ValidationException("signing key is required");
    final var bits = key.getModulus().bitLength();
    if (bits < MIN_RSA_BITS)
      throw new ValidationException(
          "RSA key size must be at least " + MIN_RSA_BITS + " bits, got " + bits);
    return new SigningKey(Kind.RSA, key);
  }

  public Kind kind() {
    return kind;
  }

  public JWSAlgorithm algorithm() {
    return kind.algorithm();
  }

  JWSSigner signer() throws JOSEException {
    if (kind == Kind.ELLIPTIC_CURVE) return new ECDSASigner((ECPrivateKey) key);
    return new RSASSASigner(key);
  }

  @Override
  public String toString() {
    return "SigningKey[" + algorithm() + "]";
  }
}
