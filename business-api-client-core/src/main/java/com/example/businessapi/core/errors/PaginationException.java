package com.example.businessapi.core.errors;

/** A pagination walk was aborted: cursor cycle, unparsable next link or page cap reached. */
public class PaginationException extends ApiClientException {

  private final int pagesFetched;

  public PaginationException(final String message, final int pagesFetched) {
    super(message);
    this.pagesFetched = pagesFetched;
  }

  public PaginationException(final String message, final int pagesFetched, final Throwable cause) {
    super(message, cause);
    this.pagesFetched = pagesFetched;
  }

  /**
   * @return number of pages handed to the consumer before the walk stopped
   */
  public int pagesFetched() {
    return pagesFetched;
  }
}
