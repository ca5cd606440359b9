package com.example.businessapi.core;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads configuration from system properties, falling back to environment variables.
 *
 * <p>Recognised keys:
 *
 * <ul>
 *   <li>apple.key.id / APPLE_KEY_ID
 *   <li>apple.issuer.id / APPLE_ISSUER_ID
 *   <li>apple.private.key.path / APPLE_PRIVATE_KEY_PATH
 *   <li>apple.api.scope / APPLE_API_SCOPE (optional, default business.api)
 *   <li>apple.api.base.url / APPLE_API_BASE_URL (optional)
 *   <li>apple.api.timeout.seconds / APPLE_API_TIMEOUT_SECONDS (optional)
 * </ul>
 */
public final class Settings {

  public static final String KEY_ID = "apple.key.id";
  public static final String ISSUER_ID = "apple.issuer.id";
  public static final String PRIVATE_KEY_PATH = "apple.private.key.path";
  public static final String SCOPE = "apple.api.scope";
  public static final String BASE_URL = "apple.api.base.url";
  public static final String TIMEOUT_SECONDS = "apple.api.timeout.seconds";

  private Settings() {}

  /**
   * Looks a key up as a system property, then as an environment variable.
   *
   * @param property system property name
   * @param env environment variable name
   * @return trimmed non-blank value
   */
  public static Optional<String> lookup(final String property, final String env) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .map(String::trim)
        .filter(val -> !val.isEmpty());
  }

  /**
   * Looks a key up using the environment variable derived from the property name ({@code
   * apple.key.id} becomes {@code APPLE_KEY_ID}).
   *
   * @param property system property name
   * @return trimmed non-blank value
   */
  public static Optional<String> lookup(final String property) {
    return lookup(property, envName(property));
  }

  /**
   * @param property system property name
   * @return a positive number of seconds, empty when unset or not a positive integer
   */
  public static Optional<Duration> lookupSeconds(final String property) {
    return lookup(property)
        .flatMap(
            val -> {
              try {
                return Optional.of(Long.parseLong(val));
              } catch (final NumberFormatException e) {
                return Optional.empty();
              }
            })
        .filter(seconds -> seconds > 0)
        .map(Duration::ofSeconds);
  }

  static String envName(final String property) {
    return property.replace('.', '_').toUpperCase(Locale.ROOT);
  }
}
