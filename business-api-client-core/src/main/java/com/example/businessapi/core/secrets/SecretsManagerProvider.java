package com.example.businessapi.core.secrets;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.businessapi.core.Settings;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;

/**
 * Shared AWS Secrets Manager access for credential documents.
 *
 * <p>The client is built on first use from system properties, falling back to environment
 * variables:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION, us-east-1 when unset
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT, e.g. a Localstack URL
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID and aws.secretAccessKey / AWS_SECRET_ACCESS_KEY,
 *       the default AWS provider chain otherwise
 *   <li>aws.sm.cache.ttl.millis / AWS_SM_CACHE_TTL_MILLIS, 0 disables caching
 * </ul>
 *
 * <p>A credential document changes rarely, so callers building several clients from the same
 * secret can enable the cache to share one fetch.
 */
public class SecretsManagerProvider {

  private static final System.Logger LOGGER =
      System.getLogger(SecretsManagerProvider.class.getName());

  private static final Region DEFAULT_REGION = Region.US_EAST_1;

  private static final Map<String, CachedDocument> DOCUMENTS = new ConcurrentHashMap<>();
  private static volatile SecretsManagerClient client;
  private static volatile Duration ttl = configuredTtl();
  private static volatile Clock clock = Clock.systemUTC();

  static {
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(SecretsManagerProvider::closeQuietly, "business-api-secrets-close"));
  }

  private SecretsManagerProvider() {}

  private static Duration configuredTtl() {
    final var raw = Settings.lookup("aws.sm.cache.ttl.millis", "AWS_SM_CACHE_TTL_MILLIS");
    if (raw.isEmpty()) return Duration.ZERO;
    try {
      return nonNegative(Long.parseLong(raw.get()));
    } catch (final NumberFormatException e) {
      LOGGER.log(WARNING, "Secret cache disabled, invalid TTL {0}", raw.get());
      return Duration.ZERO;
    }
  }

  private static Duration nonNegative(final long millis) {
    return millis <= 0 ? Duration.ZERO : Duration.ofMillis(millis);
  }

  /** For tests only: replaces the cache TTL and clock and empties the cache. */
  public static synchronized void configureCacheForTests(
      final long ttlMillis, final Clock testClock) {
    ttl = nonNegative(ttlMillis);
    clock = testClock == null ? Clock.systemUTC() : testClock;
    DOCUMENTS.clear();
  }

  /** Forgets every cached credential document. */
  public static void resetCache() {
    DOCUMENTS.clear();
  }

  /** Drops the client and the cache so the next call picks up changed AWS settings. */
  public static synchronized void resetClient() {
    closeQuietly();
    client = null;
    resetCache();
  }

  private static void closeQuietly() {
    final var current = client;
    if (current == null) return;
    try {
      current.close();
    } catch (final RuntimeException e) {
      LOGGER.log(WARNING, "Secrets Manager client did not close cleanly", e);
    }
  }

  static synchronized SecretsManagerClient getClient() {
    if (client == null) client = newClient();
    return client;
  }

  private static SecretsManagerClient newClient() {
    final var region =
        Settings.lookup("aws.region", "AWS_REGION").map(Region::of).orElse(DEFAULT_REGION);
    final var builder =
        SecretsManagerClient.builder().region(region).credentialsProvider(awsCredentials());
    final var endpoint = Settings.lookup("aws.sm.endpoint", "AWS_SM_ENDPOINT");
    endpoint.map(URI::create).ifPresent(builder::endpointOverride);
    LOGGER.log(
        INFO,
        "Secrets Manager client for {0}{1}",
        region.id(),
        endpoint.map(e -> " at " + e).orElse(""));
    return builder.build();
  }

  private static AwsCredentialsProvider awsCredentials() {
    final Optional<AwsBasicCredentials> explicit =
        Settings.lookup("aws.accessKeyId", "AWS_ACCESS_KEY_ID")
            .flatMap(
                id ->
                    Settings.lookup("aws.secretAccessKey", "AWS_SECRET_ACCESS_KEY")
                        .map(key -> AwsBasicCredentials.create(id, key)));
    if (explicit.isPresent()) return StaticCredentialsProvider.create(explicit.get());
    return DefaultCredentialsProvider.builder().build();
  }

  /**
   * Returns the secret string of a credential document, from the cache while its entry is fresh.
   *
   * @param secretId secret name or ARN
   * @return the secret string, null when the secret only has a binary value
   */
  public static String getSecret(final String secretId) {
    final var lifetime = ttl;
    if (lifetime.isZero()) return fetch(secretId);

    final var now = Instant.now(clock);
    final var cached = DOCUMENTS.get(secretId);
    if (cached != null && !now.isAfter(cached.expiresAt())) {
      LOGGER.log(DEBUG, "Secret {0} served from cache", secretId);
      return cached.value();
    }

    final var value = fetch(secretId);
    DOCUMENTS.put(secretId, new CachedDocument(value, now.plus(lifetime)));
    return value;
  }

  private static String fetch(final String secretId) {
    LOGGER.log(DEBUG, "Fetching secret {0}", secretId);
    return getClient()
        .getSecretValue(GetSecretValueRequest.builder().secretId(secretId).build())
        .secretString();
  }

  private record CachedDocument(String value, Instant expiresAt) {}
}
