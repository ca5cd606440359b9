package com.example.businessapi.core.errors;

import java.util.Map;

/**
 * One entry of an API error envelope {@code {"errors": [...]}}.
 *
 * @param id unique identifier of this occurrence, may be null
 * @param status HTTP status as reported by the API, may be null
 * @param code machine readable error code, may be null
 * @param title short summary, may be null
 * @param detail human readable explanation, may be null
 * @param source offending request element, may be null
 * @param links related documentation and resources, may be null
 * @param meta free-form metadata, never null
 */
public record ApiError(
    String id,
    String status,
    String code,
    String title,
    String detail,
    Source source,
    Links links,
    Map<String, Object> meta) {

  public ApiError {
    meta = meta == null ? Map.of() : Map.copyOf(meta);
  }

  /**
   * Location of the error in the request.
   *
   * @param pointer JSON pointer into the request document, may be null
   * @param parameter offending query parameter, may be null
   */
  public record Source(String pointer, String parameter) {}

  /**
   * Links attached to an error.
   *
   * @param about documentation for this error, may be null
   * @param associated resource the error refers to, may be null
   * @param associatedMeta metadata of the associated link, never null
   */
  public record Links(String about, String associated, Map<String, Object> associatedMeta) {
    public Links {
      associatedMeta = associatedMeta == null ? Map.of() : Map.copyOf(associatedMeta);
    }
  }

  /**
   * Renders {@code <status>: <code> - <detail>}, or {@code <status>: <detail>} without a code.
   *
   * @param httpStatus status used when the entry does not carry one
   * @return display string
   */
  public String describe(final int httpStatus) {
    final var shownStatus =
        status == null || status.isBlank() ? String.valueOf(httpStatus) : status;
    final var shownDetail = detail == null ? "" : detail;
    if (code == null || code.isBlank()) return shownStatus + ": " + shownDetail;
    return shownStatus + ": " + code + " - " + shownDetail;
  }
}
