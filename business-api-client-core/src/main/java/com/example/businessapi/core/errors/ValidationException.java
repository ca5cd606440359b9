package com.example.businessapi.core.errors;

/** Invalid caller input, detected before any network access. Never retried. */
public class ValidationException extends ApiClientException {

  public ValidationException(final String message) {
    super(message);
  }

  public ValidationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
