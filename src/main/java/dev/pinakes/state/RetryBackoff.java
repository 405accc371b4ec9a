package dev.pinakes.state;

import java.time.Duration;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Computes when a module version is due again after an attempt.
 *
 * <p>The first recorded attempt waits {@code initial}. Later attempts wait twice the previous
 * interval ({@code nextProcessedAfter - lastProcessedAt}), capped at {@code max}. A previous
 * interval that is not positive (for instance after a manual reset) restarts at {@code initial}.
 */
public final class RetryBackoff {

  private final Duration initial;
  private final Duration max;

  public RetryBackoff(Duration initial, Duration max) {
    this.initial = initial;
    this.max = max;
  }

  public Instant nextProcessedAfter(
      Instant now, @Nullable Instant lastProcessedAt, @Nullable Instant nextProcessedAfter) {
    return now.plus(delay(lastProcessedAt, nextProcessedAfter));
  }

  Duration delay(@Nullable Instant lastProcessedAt, @Nullable Instant nextProcessedAfter) {
    if (lastProcessedAt == null || nextProcessedAfter == null) {
      return initial;
    }
    Duration previous = Duration.between(lastProcessedAt, nextProcessedAfter);
    if (previous.isNegative() || previous.isZero()) {
      return initial;
    }
    Duration doubled = previous.multipliedBy(2);
    return doubled.compareTo(max) < 0 ? doubled : max;
  }
}
