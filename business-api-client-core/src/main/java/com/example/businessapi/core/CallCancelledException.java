package com.example.businessapi.core;

import java.util.concurrent.CancellationException;

/**
 * Thrown when a {@link CallContext} is cancelled, its deadline passes, or the calling thread is
 * interrupted while a call is in progress.
 *
 * <p>Not an {@link com.example.businessapi.core.errors.ApiClientException ApiClientException}, so
 * a call the caller aborted is never reported as a failed call.
 */
public class CallCancelledException extends CancellationException {

  public CallCancelledException(final String message) {
    super(message);
  }

  public CallCancelledException(final String message, final Throwable cause) {
    super(message);
    initCause(cause);
  }
}
