package com.example.businessapi.core.pagination;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.example.businessapi.core.CallCancelledException;
import com.example.businessapi.core.CallContext;
import com.example.businessapi.core.errors.HttpStatusException;
import com.example.businessapi.core.errors.PaginationException;
import com.example.businessapi.core.http.ApiRequest;
import com.example.businessapi.core.http.ApiResponse;
import com.example.businessapi.core.http.Transport;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class PaginationWalkerTest {

  private static final String BASE = "https://api.example.test/v1/orgDevices";

  private final ObjectMapper mapper =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private Transport transport;
  private List<ApiRequest> sent;

  record Device(String id) {}

  @BeforeEach
  void setUp() {
    transport = mock(Transport.class);
    sent = new CopyOnWriteArrayList<>();
  }

  private static ApiResponse page(final String body) {
    return new ApiResponse(200, Map.of(), body.getBytes(StandardCharsets.UTF_8));
  }

  private static String body(final String next, final String... ids) {
    final var data = new StringBuilder();
    for (final var id : ids) {
      if (data.length() > 0) data.append(',');
      data.append("{\"id\":\"").append(id).append("\",\"type\":\"orgDevices\"}");
    }
    final var links =
        next == null
            ? "{\"self\":\"" + BASE + "\"}"
            : "{\"self\":\"" + BASE + "\",\"next\":\"" + next + "\"}";
    return "{\"data\":[" + data + "],\"links\":" + links + "}";
  }

  /** Serves pages keyed by the request's cursor, "" for the first page. */
  private void serve(final Map<String, String> pagesByCursor) {
    when(transport.execute(any(), any()))
        .thenAnswer(
            invocation -> {
              final ApiRequest request = invocation.getArgument(1);
              sent.add(request);
              final var cursor = request.query().getOrDefault("cursor", "");
              return page(pagesByCursor.get(cursor));
            });
  }

  private List<String> ids(final byte[] page) throws IOException {
    final var ids = new ArrayList<String>();
    for (final var node : mapper.readTree(page).get("data")) ids.add(node.get("id").asText());
    return ids;
  }

  @Nested
  @DisplayName("Walking")
  class Walking {

    @Test
    @DisplayName("Should visit every page in order")
    void shouldWalkAllPages() throws Exception {
      serve(
          Map.of(
              "", body(BASE + "?cursor=c2&limit=2", "a", "b"),
              "c2", body(BASE + "?cursor=c3&limit=2", "c"),
              "c3", body(null, "d")));
      final var ids = new ArrayList<String>();
      final var walker = new PaginationWalker(transport);

      final var pages =
          walker.walk(
              CallContext.background(),
              ApiRequest.get("/v1/orgDevices").limit(2).build(),
              page -> ids.addAll(ids(page)));

      assertEquals(3, pages);
      assertEquals(List.of("a", "b", "c", "d"), ids);
    }

    @Test
    @DisplayName("Should overlay next-link parameters onto the initial query")
    void shouldOverlayQuery() throws Exception {
      serve(Map.of("", body("/v1/orgDevices?cursor=c2", "a"), "c2", body(null, "b")));
      final var initial =
          ApiRequest.get("/v1/orgDevices").fields("orgDevices", "serialNumber").limit(1).build();

      new PaginationWalker(transport).walk(CallContext.background(), initial, page -> {});

      assertEquals(2, sent.size());
      final var second = sent.get(1).query();
      assertEquals("c2", second.get("cursor"));
      assertEquals("serialNumber", second.get("fields[orgDevices]"));
      assertEquals("1", second.get("limit"));
      assertFalse(initial.query().containsKey("cursor"));
    }

    @Test
    @DisplayName("A consumer that overwrites its buffer cannot redirect the walk")
    void shouldIgnoreConsumerWrites() throws Exception {
      serve(Map.of("", body(BASE + "?cursor=c2", "a"), "c2", body(null, "b")));

      final var pages =
          new PaginationWalker(transport)
              .walk(
                  CallContext.background(),
                  ApiRequest.get("/v1/orgDevices").build(),
                  page -> Arrays.fill(page, (byte) ' '));

      assertEquals(2, pages);
      assertEquals("c2", sent.get(1).query().get("cursor"));
    }

    @Test
    @DisplayName("A blank next link ends the walk")
    void shouldStopOnBlankNext() throws Exception {
      serve(Map.of("", body("", "a")));

      final var pages =
          new PaginationWalker(transport)
              .walk(CallContext.background(), ApiRequest.get("/v1/orgDevices").build(), p -> {});

      assertEquals(1, pages);
    }

    @Test
    @DisplayName("collectAll converts the data of every page")
    void shouldCollectAll() {
      serve(Map.of("", body(BASE + "?cursor=c2", "a", "b"), "c2", body(null, "c")));

      final var devices =
          new PaginationWalker(transport, mapper, PaginationWalker.DEFAULT_MAX_PAGES)
              .collectAll(
                  CallContext.background(), ApiRequest.get("/v1/orgDevices").build(), Device.class);

      assertEquals(List.of(new Device("a"), new Device("b"), new Device("c")), devices);
    }
  }

  @Nested
  @DisplayName("Guards")
  class Guards {

    @Test
    @DisplayName("Should detect a repeated cursor")
    void shouldDetectCycle() {
      serve(
          Map.of(
              "", body(BASE + "?cursor=c2", "a"),
              "c2", body(BASE + "?cursor=c2", "b")));
      final var consumed = new ArrayList<byte[]>();

      final var ex =
          assertThrows(
              PaginationException.class,
              () ->
                  new PaginationWalker(transport)
                      .walk(
                          CallContext.background(),
                          ApiRequest.get("/v1/orgDevices").build(),
                          consumed::add));

      assertTrue(ex.getMessage().contains("Cursor cycle"), ex.getMessage());
      assertEquals(2, ex.pagesFetched());
      assertEquals(2, consumed.size());
    }

    @Test
    @DisplayName("Should detect a link back to the initial cursor")
    void shouldDetectCycleToInitialCursor() {
      serve(Map.of("c1", body(BASE + "?cursor=c1", "a")));

      final var ex =
          assertThrows(
              PaginationException.class,
              () ->
                  new PaginationWalker(transport)
                      .walk(
                          CallContext.background(),
                          ApiRequest.get("/v1/orgDevices").cursor("c1").build(),
                          page -> {}));

      assertEquals(1, ex.pagesFetched());
    }

    @Test
    @DisplayName("Should stop at the page cap")
    void shouldEnforcePageCap() {
      when(transport.execute(any(), any()))
          .thenAnswer(
              invocation -> {
                final ApiRequest request = invocation.getArgument(1);
                final var n = Integer.parseInt(request.query().getOrDefault("cursor", "0"));
                return page(body(BASE + "?cursor=" + (n + 1), "x" + n));
              });

      final var ex =
          assertThrows(
              PaginationException.class,
              () ->
                  new PaginationWalker(transport, mapper, 3)
                      .walk(
                          CallContext.background(),
                          ApiRequest.get("/v1/orgDevices").build(),
                          page -> {}));

      assertEquals(3, ex.pagesFetched());
      verify(transport, times(3)).execute(any(), any());
    }

    @Test
    @DisplayName("Should reject an unparsable page")
    void shouldRejectUnparsablePage() {
      when(transport.execute(any(), any())).thenReturn(page("<html>"));

      assertThrows(
          PaginationException.class,
          () ->
              new PaginationWalker(transport)
                  .walk(CallContext.background(), ApiRequest.get("/v1/x").build(), page -> {}));
    }

    @Test
    void shouldRejectInvalidCap() {
      assertThrows(
          IllegalArgumentException.class, () -> new PaginationWalker(transport, mapper, 0));
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("Consumer exceptions end the walk unchanged")
    void shouldPropagateConsumerException() {
      serve(Map.of("", body(BASE + "?cursor=c2", "a")));
      final var failure = new IOException("disk full");

      final var ex =
          assertThrows(
              IOException.class,
              () ->
                  new PaginationWalker(transport)
                      .walk(
                          CallContext.background(),
                          ApiRequest.get("/v1/orgDevices").build(),
                          page -> {
                            throw failure;
                          }));

      assertSame(failure, ex);
      verify(transport, times(1)).execute(any(), any());
    }

    @Test
    @DisplayName("Transport errors end the walk unchanged")
    void shouldPropagateTransportError() {
      when(transport.execute(any(), any())).thenThrow(new HttpStatusException(503, "busy"));

      assertThrows(
          HttpStatusException.class,
          () ->
              new PaginationWalker(transport)
                  .walk(CallContext.background(), ApiRequest.get("/v1/x").build(), page -> {}));
    }

    @Test
    @DisplayName("Cancellation between pages stops the walk")
    void shouldStopWhenCancelled() {
      serve(Map.of("", body(BASE + "?cursor=c2", "a"), "c2", body(null, "b")));
      final var ctx = CallContext.cancellable();

      assertThrows(
          CallCancelledException.class,
          () ->
              new PaginationWalker(transport)
                  .walk(ctx, ApiRequest.get("/v1/orgDevices").build(), page -> ctx.cancel()));

      verify(transport, times(1)).execute(any(), any());
    }
  }

  @Nested
  @DisplayName("Next links")
  class NextLinks {

    @Test
    void shouldReadRelativeLink() {
      assertEquals(
          Map.of("cursor", "abc", "limit", "5"),
          PaginationWalker.queryOf("/v1/orgDevices?cursor=abc&limit=5", 1));
    }

    @Test
    void shouldKeepFirstValue() {
      assertEquals(
          Map.of("cursor", "first"),
          PaginationWalker.queryOf(BASE + "?cursor=first&cursor=second", 1));
    }

    @Test
    void shouldDecodeValues() {
      final var query = PaginationWalker.queryOf(BASE + "?fields%5BorgDevices%5D=a%2Cb", 1);
      assertEquals("a,b", query.get("fields[orgDevices]"));
    }
  }

  @Nested
  @DisplayName("Envelope")
  class Envelope {

    @Test
    void shouldReadNavigation() throws Exception {
      final var envelope =
          mapper.readValue(
              "{\"links\":{\"next\":\"n\",\"prev\":\"p\"},"
                  + "\"meta\":{\"paging\":{\"total\":42,\"limit\":10,\"nextCursor\":\"c\"}}}",
              PageEnvelope.class);

      assertTrue(envelope.hasNext());
      assertTrue(envelope.hasPrevious());
      assertEquals(42, envelope.paging().orElseThrow().total());
      assertEquals("c", envelope.paging().orElseThrow().nextCursor());
    }

    @Test
    void shouldHandleMissingLinks() throws Exception {
      final var envelope = mapper.readValue("{\"data\":[]}", PageEnvelope.class);

      assertFalse(envelope.hasNext());
      assertFalse(envelope.hasPrevious());
      assertTrue(envelope.paging().isEmpty());
    }
  }
}
