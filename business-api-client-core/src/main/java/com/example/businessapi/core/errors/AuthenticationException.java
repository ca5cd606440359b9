package com.example.businessapi.core.errors;

/** Signing the client assertion or exchanging it for an access token failed. */
public class AuthenticationException extends ApiClientException {

  public AuthenticationException(final String message) {
    super(message);
  }

  public AuthenticationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
