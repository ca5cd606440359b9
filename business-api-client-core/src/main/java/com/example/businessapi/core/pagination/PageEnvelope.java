package com.example.businessapi.core.pagination;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Optional;

/**
 * Navigation part of a paginated response: {@code {"links": {...}, "meta": {"paging": {...}}}}.
 * The {@code data} member is left to the page consumer.
 *
 * @param links navigation links, may be null
 * @param meta paging metadata, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PageEnvelope(Links links, Meta meta) {

  /**
   * @param self this page
   * @param first first page
   * @param next next page, absent on the last page
   * @param prev previous page
   * @param last last page
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Links(String self, String first, String next, String prev, String last) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Meta(Paging paging) {}

  /**
   * @param total total number of items, may be null
   * @param limit page size, may be null
   * @param nextCursor cursor of the next page, may be null
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Paging(Integer total, Integer limit, String nextCursor) {}

  public Optional<String> next() {
    return Optional.ofNullable(links).map(Links::next).filter(next -> !next.isBlank());
  }

  public boolean hasNext() {
    return next().isPresent();
  }

  public boolean hasPrevious() {
    return links != null && links.prev() != null && !links.prev().isBlank();
  }

  public Optional<Paging> paging() {
    return Optional.ofNullable(meta).map(Meta::paging);
  }
}
