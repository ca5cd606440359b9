package com.example.businessapi.core;

import static org.junit.jupiter.api.Assertions.*;

import com.example.businessapi.core.errors.ApiClientException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class CallContextTest {

  @AfterEach
  void clearInterruptFlag() {
    if (Thread.currentThread().isInterrupted()) Thread.interrupted();
  }

  @Nested
  @DisplayName("Cancellation")
  class Cancellation {

    @Test
    @DisplayName("Background context ignores cancel")
    void backgroundIsNeverCancelled() {
      final var ctx = CallContext.background();
      ctx.cancel();

      assertFalse(ctx.isCancelled());
      assertTrue(ctx.cancellationReason().isEmpty());
      assertDoesNotThrow(ctx::throwIfCancelled);
    }

    @Test
    @DisplayName("Cancelled context throws CallCancelledException")
    void cancelledContextThrows() {
      final var ctx = CallContext.cancellable();
      ctx.cancel();

      assertTrue(ctx.isCancelled());
      assertEquals("context cancelled", ctx.cancellationReason().orElseThrow());
      final var ex = assertThrows(CallCancelledException.class, ctx::throwIfCancelled);
      assertEquals("context cancelled", ex.getMessage());
    }

    @Test
    @DisplayName("Cancellation is not an API failure")
    void cancellationIsNotAnApiClientException() {
      assertFalse(ApiClientException.class.isAssignableFrom(CallCancelledException.class));
    }

    @Test
    @DisplayName("Child is cancelled with its parent, not the other way round")
    void childFollowsParent() {
      final var parent = CallContext.cancellable();
      final var child = parent.withCancel();
      final var sibling = parent.withCancel();

      sibling.cancel();
      assertFalse(parent.isCancelled());
      assertFalse(child.isCancelled());

      parent.cancel();
      assertTrue(child.isCancelled());
    }

    @Test
    @DisplayName("Closed children no longer hold hooks on their parent")
    void closedChildrenDetach() {
      final var parent = CallContext.cancellable();

      for (var i = 0; i < 10_000; i++) {
        try (var child = parent.withCancel()) {
          assertFalse(child.isCancelled());
        }
        try (var timed = parent.withTimeout(Duration.ofMinutes(5))) {
          assertFalse(timed.isCancelled());
        }
      }

      assertEquals(0, parent.hookCount());
      assertFalse(parent.isCancelled());
    }

    @Test
    @DisplayName("Closing a child leaves the parent and its siblings running")
    void closeOnlyEndsTheChild() {
      final var parent = CallContext.cancellable();
      final var sibling = parent.withCancel();
      final var child = parent.withCancel();

      child.close();

      assertTrue(child.isCancelled());
      assertEquals("context closed", child.cancellationReason().orElseThrow());
      assertFalse(parent.isCancelled());
      assertFalse(sibling.isCancelled());
      assertEquals(1, parent.hookCount());
    }

    @Test
    @DisplayName("Interrupted thread is reported as cancelled and keeps its flag")
    void interruptedThreadThrows() {
      Thread.currentThread().interrupt();

      assertThrows(CallCancelledException.class, () -> CallContext.background().throwIfCancelled());
      assertTrue(Thread.currentThread().isInterrupted());
    }
  }

  @Nested
  @DisplayName("Deadlines")
  class Deadlines {

    @Test
    @DisplayName("Should cancel once the timeout elapses")
    void timeoutCancels() {
      final var ctx = CallContext.background().withTimeout(Duration.ofMillis(50));
      final var start = System.nanoTime();

      final var ex =
          assertThrows(CallCancelledException.class, () -> ctx.sleep(Duration.ofSeconds(10)));

      final var elapsed = Duration.ofNanos(System.nanoTime() - start);
      assertTrue(elapsed.compareTo(Duration.ofSeconds(5)) < 0, "woke after " + elapsed);
      assertTrue(ex.getMessage().startsWith("deadline exceeded"), ex.getMessage());
    }

    @Test
    @DisplayName("Should reject non-positive timeouts")
    void rejectsNonPositiveTimeout() {
      final var ctx = CallContext.background();
      assertThrows(IllegalArgumentException.class, () -> ctx.withTimeout(Duration.ZERO));
      assertThrows(IllegalArgumentException.class, () -> ctx.withTimeout(Duration.ofSeconds(-1)));
    }
  }

  @Nested
  @DisplayName("Waiting")
  class Waiting {

    @Test
    @DisplayName("Sleep returns after the duration when not cancelled")
    void sleepCompletes() {
      final var ctx = CallContext.cancellable();
      final var start = System.nanoTime();

      ctx.sleep(Duration.ofMillis(100));

      assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() >= 90);
    }

    @Test
    @DisplayName("Sleep wakes early when cancelled from another thread")
    void sleepWakesOnCancel() {
      final var ctx = CallContext.cancellable();
      final var scheduler = Executors.newSingleThreadScheduledExecutor();
      try {
        scheduler.schedule(ctx::cancel, 100, TimeUnit.MILLISECONDS);
        final var start = System.nanoTime();

        assertThrows(CallCancelledException.class, () -> ctx.sleep(Duration.ofSeconds(30)));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 5);
      } finally {
        scheduler.shutdownNow();
      }
    }

    @Test
    @DisplayName("Await returns the future's value")
    void awaitReturnsValue() throws Exception {
      assertEquals(
          "value", CallContext.cancellable().await(CompletableFuture.completedFuture("value")));
    }

    @Test
    @DisplayName("Await reports failures as ExecutionException")
    void awaitReportsFailure() {
      final var failed = CompletableFuture.<String>failedFuture(new IllegalStateException("boom"));

      final var ex =
          assertThrows(ExecutionException.class, () -> CallContext.cancellable().await(failed));
      assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    @DisplayName("Await is abandoned on cancel while the future keeps running")
    void awaitAbandonedOnCancel() throws Exception {
      final var ctx = CallContext.cancellable();
      final var pending = new CompletableFuture<String>();
      final var waiting = new CountDownLatch(1);
      final var outcome = new CompletableFuture<Throwable>();

      final var waiter =
          new Thread(
              () -> {
                waiting.countDown();
                try {
                  ctx.await(pending);
                  outcome.complete(null);
                } catch (final Throwable t) {
                  outcome.complete(t);
                }
              });
      waiter.start();
      assertTrue(waiting.await(5, TimeUnit.SECONDS));
      Thread.sleep(50);
      ctx.cancel();

      assertInstanceOf(CallCancelledException.class, outcome.get(5, TimeUnit.SECONDS));
      assertFalse(pending.isDone());
    }
  }

  @Nested
  @DisplayName("Cancellation hooks")
  class Hooks {

    @Test
    @DisplayName("Should run registered hooks once on cancel")
    void runsHooks() {
      final var ctx = CallContext.cancellable();
      final var calls = new AtomicInteger();
      ctx.onCancel(calls::incrementAndGet);

      ctx.cancel();
      ctx.cancel();

      assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Closed registration is not run")
    void closedRegistrationSkipped() {
      final var ctx = CallContext.cancellable();
      final var calls = new AtomicInteger();
      try (var ignored = ctx.onCancel(calls::incrementAndGet)) {
        assertEquals(0, calls.get());
      }

      ctx.cancel();

      assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("Hook registered after cancellation runs immediately")
    void lateHookRunsImmediately() {
      final var ctx = CallContext.cancellable();
      ctx.cancel();
      final var calls = new AtomicInteger();

      ctx.onCancel(calls::incrementAndGet);

      assertEquals(1, calls.get());
    }
  }
}
