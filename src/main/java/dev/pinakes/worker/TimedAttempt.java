package dev.pinakes.worker;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.jspecify.annotations.Nullable;

/**
 * Wraps one attempt so the worker can time it from the moment a pool thread picks it up, and can
 * withdraw it while it is still queued.
 */
final class TimedAttempt<T> implements Callable<T> {

  private static final int QUEUED = 0;
  private static final int RUNNING = 1;
  private static final int WITHDRAWN = 2;

  private final Callable<T> body;
  private final AtomicInteger state = new AtomicInteger(QUEUED);
  private final CountDownLatch started = new CountDownLatch(1);
  private volatile long startedAtNanos;

  TimedAttempt(Callable<T> body) {
    this.body = body;
  }

  /** Runs the body, or returns {@code null} at once if the attempt was withdrawn first. */
  @Override
  public @Nullable T call() throws Exception {
    if (!state.compareAndSet(QUEUED, RUNNING)) {
      return null;
    }
    startedAtNanos = System.nanoTime();
    started.countDown();
    return body.call();
  }

  /**
   * Waits up to {@code timeout} for a pool thread to pick the attempt up. If none does, the attempt
   * is withdrawn and will never run.
   *
   * @return whether the attempt is running (or has run)
   */
  boolean awaitStart(long timeout, TimeUnit unit) throws InterruptedException {
    if (started.await(timeout, unit)) {
      return true;
    }
    if (state.compareAndSet(QUEUED, WITHDRAWN)) {
      return false;
    }
    // picked up between the timeout and the withdrawal
    started.await();
    return true;
  }

  /** Nanoseconds left of {@code budgetNanos}, counted from the start of the attempt. */
  long remainingNanos(long budgetNanos) {
    return startedAtNanos + budgetNanos - System.nanoTime();
  }
}
