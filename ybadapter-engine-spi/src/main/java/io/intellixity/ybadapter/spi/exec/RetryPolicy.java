package io.intellixity.ybadapter.spi.exec;

import io.intellixity.ybadapter.error.ConnectionException;

import java.time.Duration;
import java.util.Objects;
import java.util.function.IntFunction;
import java.util.function.Predicate;

/**
 * Bounded retry policy for opening a connection.
 *
 * @param retryLimit how many times a retryable failure may be retried (attempts = retryLimit + 1)
 * @param backoff delay before the next attempt, given the number of retries already made (0-based)
 * @param retryable which failures may be retried; everything else fails the open immediately
 */
public record RetryPolicy(int retryLimit, IntFunction<Duration> backoff, Predicate<Throwable> retryable) {
  public RetryPolicy {
    Objects.requireNonNull(backoff, "backoff");
    Objects.requireNonNull(retryable, "retryable");
  }

  /** Quadratic backoff in seconds: 0s, 1s, 4s, 9s, ... */
  public static Duration quadraticBackoff(int attempt) {
    return Duration.ofSeconds((long) attempt * attempt);
  }

  public static RetryPolicy noRetry() {
    return new RetryPolicy(0, a -> Duration.ZERO, t -> false);
  }

  public boolean isRetryable(Throwable t) {
    return retryable.test(t);
  }

  /** Delay before retry {@code attempt}; a missing or negative delay fails the open. */
  public Duration delayFor(int attempt) {
    Duration d = backoff.apply(attempt);
    if (d == null || d.isNegative()) {
      throw new ConnectionException("retry timeout cannot be negative or missing: " + d + " (retry " + attempt + ")");
    }
    return d;
  }
}
