package dev.folio.search.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

class QueryDeadlineTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  @Test
  void noneIsNeverExpired() {
    QueryDeadline deadline = QueryDeadline.none();

    assertThat(deadline.isExpired()).isFalse();
    assertThat(deadline.remainingMillis()).isEqualTo(Long.MAX_VALUE);
  }

  @Test
  void reportsRemainingTime() {
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    QueryDeadline deadline = QueryDeadline.after(Duration.ofSeconds(2), clock);

    assertThat(deadline.remainingMillis()).isEqualTo(2000);
    assertThat(deadline.isExpired()).isFalse();
  }

  @Test
  void expiredDeadlineFailsPendingCallImmediately() {
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    QueryDeadline deadline = QueryDeadline.after(Duration.ZERO, clock);
    CompletableFuture<String> call = new CompletableFuture<>();

    CompletableFuture<String> bounded = deadline.bound(call);

    assertThat(deadline.isExpired()).isTrue();
    assertThat(call).isCancelled();
    assertThatThrownBy(bounded::join).hasCauseInstanceOf(TimeoutException.class);
  }

  @Test
  void pendingCallTimesOutAtDeadline() {
    QueryDeadline deadline = QueryDeadline.after(Duration.ofMillis(50), Clock.systemUTC());

    CompletableFuture<String> bounded = deadline.bound(new CompletableFuture<>());

    assertThatThrownBy(bounded::join)
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(TimeoutException.class);
  }

  @Test
  void completedCallPassesThrough() {
    QueryDeadline deadline = QueryDeadline.after(Duration.ofSeconds(5), Clock.systemUTC());

    assertThat(deadline.bound(CompletableFuture.completedFuture("done")).join()).isEqualTo("done");
  }
}
