package dev.folio.search.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;

/**
 * Absolute point in time by which a query's adapter and reranker calls must complete. Calls still
 * running past the deadline are abandoned and treated as unavailable.
 */
public final class QueryDeadline {

  private static final QueryDeadline NONE = new QueryDeadline(null, Clock.systemUTC());

  private final @Nullable Instant expiresAt;
  private final Clock clock;

  private QueryDeadline(@Nullable Instant expiresAt, Clock clock) {
    this.expiresAt = expiresAt;
    this.clock = clock;
  }

  public static QueryDeadline after(Duration timeout, Clock clock) {
    return new QueryDeadline(clock.instant().plus(timeout), clock);
  }

  public static QueryDeadline none() {
    return NONE;
  }

  /** Remaining time, or {@code Long.MAX_VALUE} milliseconds when unbounded. */
  public long remainingMillis() {
    if (expiresAt == null) {
      return Long.MAX_VALUE;
    }
    return Math.max(0L, Duration.between(clock.instant(), expiresAt).toMillis());
  }

  public boolean isExpired() {
    return expiresAt != null && !clock.instant().isBefore(expiresAt);
  }

  /**
   * Bounds a pending call by this deadline. The returned future fails with a {@link
   * TimeoutException} when the deadline passes first; an already expired deadline cancels the call
   * immediately.
   */
  public <T> CompletableFuture<T> bound(CompletableFuture<T> call) {
    if (expiresAt == null) {
      return call;
    }
    long remaining = remainingMillis();
    if (remaining <= 0) {
      call.cancel(true);
      return CompletableFuture.failedFuture(new TimeoutException("Query deadline already passed"));
    }
    return call.orTimeout(remaining, TimeUnit.MILLISECONDS);
  }
}
