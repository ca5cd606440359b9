package com.example.businessapi.core.secrets;

import com.example.businessapi.core.auth.Credential;
import com.example.businessapi.core.errors.ApiClientException;
import com.example.businessapi.core.errors.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.function.Supplier;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Fetches an API credential from AWS Secrets Manager and parses it into a {@link Credential}
 * using Jackson.
 */
public class SecretHelper {

  private static Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

  private SecretHelper() {}

  /** Replaces the mapper used to read credential documents, e.g. one with custom modules. */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  /**
   * Retrieves the credential secret and converts it into a {@link Credential}.
   *
   * @param secretId secret name or ARN
   * @return the parsed credential
   * @throws ValidationException if the secret content is not a valid credential
   * @throws ApiClientException if the secret cannot be fetched
   */
  public static Credential getCredential(final String secretId) {
    return parse(secretId, fetch(secretId)).toCredential();
  }

  /** Reads the credential document without parsing its private key. */
  public static CredentialSecret getCredentialSecret(final String secretId) {
    return parse(secretId, fetch(secretId));
  }

  static CredentialSecret parse(final String secretId, final String json) {
    if (json == null || json.isBlank())
      throw new ValidationException("Secret " + secretId + " has no string value");
    try {
      return mapperSupplier.get().readValue(json, CredentialSecret.class);
    } catch (final JsonProcessingException e) {
      throw new ValidationException("Secret " + secretId + " is not a credential document", e);
    }
  }

  private static String fetch(final String secretId) {
    if (secretId == null || secretId.isBlank())
      throw new ValidationException("secretId is required");
    try {
      return SecretsManagerProvider.getSecret(secretId);
    } catch (final SdkException e) {
      throw new ApiClientException("Failed to load API credential secret " + secretId, e);
    }
  }
}
