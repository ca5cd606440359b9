package com.example.businessapi.core.errors;

/** The request never produced a response: connection refused, reset, TLS or timeout failures. */
public class NetworkException extends ApiClientException {

  public NetworkException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
