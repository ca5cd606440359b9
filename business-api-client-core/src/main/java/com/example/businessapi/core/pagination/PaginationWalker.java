package com.example.businessapi.core.pagination;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.businessapi.core.CallContext;
import com.example.businessapi.core.errors.PaginationException;
import com.example.businessapi.core.http.ApiRequest;
import com.example.businessapi.core.http.Transport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.hc.core5.net.URIBuilder;

/**
 * Follows {@code links.next} through a cursor-paginated collection.
 *
 * <p>Each page body is handed to the consumer before the next one is requested. The next request
 * reuses the initial one with its query parameters overlaid by those of the next link, so
 * parameters the link omits (filters, field selections) carry over and the caller's request is
 * never modified. A walk stops when a page has no next link, and fails with {@link
 * PaginationException} when a next link repeats a cursor seen earlier in the walk, cannot be
 * parsed, or when more than {@code maxPages} pages would be fetched.
 *
 * <pre>{@code
 * var devices = new ArrayList<Device>();
 * walker.walk(ctx, ApiRequest.get("/v1/orgDevices").limit(1000).build(), page ->
 *     devices.addAll(mapper.readValue(page, DevicePage.class).data()));
 * }</pre>
 */
public final class PaginationWalker {

  private static final System.Logger LOGGER = System.getLogger(PaginationWalker.class.getName());

  public static final int DEFAULT_MAX_PAGES = 10_000;

  static final String CURSOR = "cursor";

  private final Transport transport;
  private final ObjectMapper mapper;
  private final int maxPages;

  public PaginationWalker(final Transport transport) {
    this(transport, new ObjectMapper(), DEFAULT_MAX_PAGES);
  }

  public PaginationWalker(
      final Transport transport, final ObjectMapper mapper, final int maxPages) {
    if (transport == null) throw new IllegalArgumentException("transport is required");
    if (mapper == null) throw new IllegalArgumentException("mapper is required");
    if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
    this.transport = transport;
    this.mapper = mapper;
    this.maxPages = maxPages;
  }

  /**
   * Walks every page reachable from {@code initial}.
   *
   * @param ctx cancellation scope of the whole walk
   * @param initial first page request
   * @param consumer receives each page body
   * @param <E> exception type of the consumer
   * @return number of pages consumed
   * @throws E as thrown by the consumer, ending the walk
   * @throws PaginationException on cursor cycles, unparsable links or the page cap
   */
  public <E extends Exception> int walk(
      final CallContext ctx, final ApiRequest initial, final PageConsumer<E> consumer) throws E {
    var params = new LinkedHashMap<>(initial.query());
    final var seen = new HashSet<String>();
    seen.add(marker(params));

    var pages = 0;
    while (true) {
      ctx.throwIfCancelled();
      if (pages >= maxPages)
        throw new PaginationException(
            "Page limit of " + maxPages + " reached for " + initial.describe(), pages);

      final var response = transport.execute(ctx, initial.withQuery(params));
      pages++;
      final var body = response.body();
      final var envelope = envelope(body, pages);
      consumer.consume(body);

      if (!envelope.hasNext()) {
        LOGGER.log(DEBUG, "Walk of {0} finished after {1} page(s)", initial.describe(), pages);
        return pages;
      }

      final var next = new LinkedHashMap<>(params);
      next.putAll(queryOf(envelope.next().orElseThrow(), pages));
      if (!seen.add(marker(next)))
        throw new PaginationException(
            "Cursor cycle detected at page " + pages + " of " + initial.describe(), pages);
      params = next;
    }
  }

  /**
   * Walks every page and converts the elements of each page's {@code data} array.
   *
   * @param ctx cancellation scope of the whole walk
   * @param initial first page request
   * @param itemType element type
   * @param <T> element type
   * @return all elements in page order
   */
  public <T> List<T> collectAll(
      final CallContext ctx, final ApiRequest initial, final Class<T> itemType) {
    final var items = new ArrayList<T>();
    final var pages = new int[] {0};
    walk(
        ctx,
        initial,
        page -> {
          pages[0]++;
          final JsonNode data = readTree(page, pages[0]).get("data");
          if (data == null || data.isNull()) return;
          if (!data.isArray())
            throw new PaginationException(
                "Data of page " + pages[0] + " is not an array", pages[0]);
          for (final var element : data) items.add(convert(element, itemType, pages[0]));
        });
    return items;
  }

  private PageEnvelope envelope(final byte[] body, final int pages) {
    try {
      return mapper.readValue(body, PageEnvelope.class);
    } catch (final IOException e) {
      throw new PaginationException("Unparsable page " + pages + ": " + e.getMessage(), pages, e);
    }
  }

  private JsonNode readTree(final byte[] body, final int pages) {
    try {
      return mapper.readTree(body);
    } catch (final IOException e) {
      throw new PaginationException("Unparsable page " + pages + ": " + e.getMessage(), pages, e);
    }
  }

  private <T> T convert(final JsonNode element, final Class<T> itemType, final int pages) {
    try {
      return mapper.treeToValue(element, itemType);
    } catch (final IOException e) {
      throw new PaginationException(
          "Cannot read " + itemType.getSimpleName() + ": " + e.getMessage(), pages, e);
    }
  }

  /**
   * Extracts the query parameters of a next link, first value per name.
   *
   * @param link absolute or relative URL
   * @param pages pages consumed so far, for error reporting
   * @return parameters in link order
   */
  static Map<String, String> queryOf(final String link, final int pages) {
    try {
      final var params = new LinkedHashMap<String, String>();
      for (final var pair : new URIBuilder(link).getQueryParams()) {
        params.putIfAbsent(pair.getName(), pair.getValue() == null ? "" : pair.getValue());
      }
      return params;
    } catch (final URISyntaxException e) {
      throw new PaginationException("Unparsable next link: " + link, pages, e);
    }
  }

  private static String marker(final Map<String, String> params) {
    final var cursor = params.get(CURSOR);
    return cursor != null ? CURSOR + "=" + cursor : params.toString();
  }
}
