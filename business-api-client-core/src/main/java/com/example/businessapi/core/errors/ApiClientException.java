package com.example.businessapi.core.errors;

/**
 * Base type of every failure raised by the client.
 *
 * <p>Subclasses separate the failure domains: signing and token exchange ({@link
 * AuthenticationException}), transport without a response ({@link NetworkException}), non-2xx
 * responses ({@link HttpStatusException} and {@link ApiErrorException}), invalid caller input
 * ({@link ValidationException}) and pagination aborts ({@link PaginationException}).
 */
public class ApiClientException extends RuntimeException {

  public ApiClientException(final String message) {
    super(message);
  }

  public ApiClientException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
