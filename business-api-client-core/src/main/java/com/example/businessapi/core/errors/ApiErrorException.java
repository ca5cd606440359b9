package com.example.businessapi.core.errors;

import java.util.List;

/**
 * Non-2xx response carrying a structured error envelope. The message is built from the first
 * entry; {@link #errors()} keeps them all.
 */
public class ApiErrorException extends HttpStatusException {

  private final List<ApiError> errors;

  public ApiErrorException(final int status, final List<ApiError> errors, final String body) {
    super(status, body, requireFirst(errors).describe(status));
    this.errors = List.copyOf(errors);
  }

  private static ApiError requireFirst(final List<ApiError> errors) {
    if (errors == null || errors.isEmpty())
      throw new IllegalArgumentException("errors must not be empty");
    return errors.get(0);
  }

  /**
   * @return every error entry in response order
   */
  public List<ApiError> errors() {
    return errors;
  }

  /**
   * @return the entry the message was built from
   */
  public ApiError firstError() {
    return errors.get(0);
  }

  /**
   * @return the API's error code, falling back to {@code HTTP_<status>}
   */
  @Override
  public String code() {
    final var code = firstError().code();
    return code == null || code.isBlank() ? super.code() : code;
  }
}
