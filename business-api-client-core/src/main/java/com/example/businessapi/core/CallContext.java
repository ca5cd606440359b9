package com.example.businessapi.core;

import static java.lang.System.Logger.Level.DEBUG;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-call cancellation scope passed to every blocking operation of the client.
 *
 * <p>A context is cancelled explicitly through {@link #cancel()}, when its deadline passes, or
 * when its parent is cancelled. Cancellation wakes every backoff wait, aborts in-flight HTTP
 * exchanges registered through {@link #onCancel(Runnable)} and surfaces to the caller as a {@link
 * CallCancelledException}.
 *
 * <p>A derived context stays linked to its parent until it is cancelled or closed, so contexts
 * derived from a long-lived parent should be closed once the call returns.
 *
 * <pre>{@code
 * try (var ctx = CallContext.background().withTimeout(Duration.ofMinutes(2))) {
 *   client.walk(ctx, request, page -> devices.addAll(parse(page)));
 * }
 * }</pre>
 */
public final class CallContext implements AutoCloseable {

  private static final System.Logger LOGGER = System.getLogger(CallContext.class.getName());

  private static final CallContext BACKGROUND = new CallContext();

  private static final ScheduledThreadPoolExecutor DEADLINES = deadlineScheduler();

  private final boolean cancellable;
  private final CompletableFuture<Void> done = new CompletableFuture<>();
  private final AtomicReference<String> reason = new AtomicReference<>();
  private final Set<Runnable> listeners = ConcurrentHashMap.newKeySet();

  private static ScheduledThreadPoolExecutor deadlineScheduler() {
    final var scheduler =
        new ScheduledThreadPoolExecutor(
            1,
            r -> {
              final var t = new Thread(r, "CallContext-deadline");
              t.setDaemon(true);
              return t;
            });
    // closed contexts drop their timers right away
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  private CallContext() {
    this.cancellable = false;
  }

  private CallContext(final CallContext parent) {
    this.cancellable = true;
    if (parent.cancellable) {
      final var link = parent.onCancel(() -> cancel(parent.reason.get()));
      done.whenComplete((ignored, error) -> link.close());
    }
  }

  /**
   * Returns the root context. It is never cancelled and carries no deadline.
   *
   * @return the shared background context
   */
  public static CallContext background() {
    return BACKGROUND;
  }

  /**
   * Returns a new cancellable context with no deadline.
   *
   * @return a fresh cancellable context
   */
  public static CallContext cancellable() {
    return new CallContext(BACKGROUND);
  }

  /**
   * Derives a child context that is cancelled together with this one or through its own {@link
   * #cancel()}.
   *
   * @return child context
   */
  public CallContext withCancel() {
    return new CallContext(this);
  }

  /**
   * Derives a child context that cancels itself once {@code timeout} has elapsed.
   *
   * @param timeout time until the child is cancelled, must be positive
   * @return child context with a deadline
   */
  public CallContext withTimeout(final Duration timeout) {
    if (timeout == null || timeout.isNegative() || timeout.isZero())
      throw new IllegalArgumentException("timeout must be positive");
    final var child = new CallContext(this);
    final var deadline =
        DEADLINES.schedule(
            () -> child.cancel("deadline exceeded after " + timeout),
            millis(timeout),
            TimeUnit.MILLISECONDS);
    child.done.whenComplete((ignored, error) -> deadline.cancel(false));
    return child;
  }

  /** Cancels this context and every context derived from it. No-op on the background context. */
  public void cancel() {
    cancel("context cancelled");
  }

  /**
   * Ends this context once its call has finished: detaches it from its parent, stops its deadline
   * timer and runs pending hooks. The context counts as cancelled afterwards.
   */
  @Override
  public void close() {
    cancel("context closed");
  }

  private void cancel(final String why) {
    if (!cancellable || !reason.compareAndSet(null, why)) return;
    LOGGER.log(DEBUG, "Call context cancelled: {0}", why);
    for (final var listener : listeners) listener.run();
    listeners.clear();
    done.complete(null);
  }

  /**
   * @return true once this context has been cancelled
   */
  public boolean isCancelled() {
    return reason.get() != null;
  }

  /**
   * @return the cancellation reason, empty while the context is live
   */
  public Optional<String> cancellationReason() {
    return Optional.ofNullable(reason.get());
  }

  /**
   * Throws if this context is cancelled or the current thread has been interrupted. The interrupt
   * flag is left set.
   *
   * @throws CallCancelledException if the call must stop
   */
  public void throwIfCancelled() {
    final var why = reason.get();
    if (why != null) throw new CallCancelledException(why);
    if (Thread.currentThread().isInterrupted())
      throw new CallCancelledException("thread interrupted");
  }

  /**
   * Registers an action to run when this context is cancelled. When the context is already
   * cancelled the action runs immediately on the calling thread.
   *
   * @param action cancellation hook, typically aborting an in-flight request
   * @return registration that removes the hook when closed
   */
  public Registration onCancel(final Runnable action) {
    if (!cancellable) return () -> {};
    listeners.add(action);
    if (isCancelled() && listeners.remove(action)) action.run();
    return () -> listeners.remove(action);
  }

  /**
   * Sleeps for the given duration, waking early if this context is cancelled.
   *
   * @param duration how long to wait
   * @throws CallCancelledException if the context is cancelled before or during the wait
   */
  public void sleep(final Duration duration) {
    throwIfCancelled();
    if (duration == null || duration.isNegative() || duration.isZero()) return;
    try {
      done.get(millis(duration), TimeUnit.MILLISECONDS);
    } catch (final TimeoutException elapsed) {
      return;
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new CallCancelledException("interrupted during wait", ie);
    } catch (final ExecutionException e) {
      throw new IllegalStateException("cancellation signal failed", e);
    }
    throwIfCancelled();
  }

  /**
   * Waits for a future that may be shared with other callers. Cancelling this context abandons the
   * wait but leaves the future running.
   *
   * @param future the result to wait for
   * @param <T> result type
   * @return the future's value
   * @throws ExecutionException if the future completed exceptionally
   * @throws CallCancelledException if this context is cancelled first
   */
  public <T> T await(final CompletableFuture<T> future) throws ExecutionException {
    throwIfCancelled();
    try {
      CompletableFuture.anyOf(future.handle((value, error) -> null), done).get();
      if (!future.isDone()) throwIfCancelled();
      return future.get();
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new CallCancelledException("interrupted while waiting", ie);
    }
  }

  int hookCount() {
    return listeners.size();
  }

  /** Duration in milliseconds, saturating at {@link Long#MAX_VALUE}. */
  static long millis(final Duration duration) {
    try {
      return duration.toMillis();
    } catch (final ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  /** Handle returned by {@link #onCancel(Runnable)}. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
