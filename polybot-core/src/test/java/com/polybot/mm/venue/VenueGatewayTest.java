package com.polybot.mm.venue;

import com.polybot.mm.domain.OrderSide;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith({MockitoExtension.class, OutputCaptureExtension.class})
class VenueGatewayTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

  @Mock
  private VenueOrderApi delegate;

  private VenueGateway gateway;

  @BeforeEach
  void setUp() {
    gateway = new VenueGateway(delegate, Clock.fixed(NOW, ZoneOffset.UTC), 4, 200);
  }

  @AfterEach
  void tearDown() {
    gateway.close();
  }

  @Test
  void slowCallDegradesToEmptyResult() {
    when(delegate.getPortfolioValue()).thenAnswer(inv -> {
      Thread.sleep(2_000);
      return OptionalDouble.of(100.0);
    });

    assertThat(gateway.getPortfolioValue()).isEmpty();
  }

  @Test
  void failingCallDegradesToFalse() {
    when(delegate.cancelOrder("o1")).thenThrow(new IllegalStateException("boom"));

    assertThat(gateway.cancelOrder("o1")).isFalse();
  }

  @Test
  void timedOutPlacementIsReportedAsTimeoutError(CapturedOutput output) {
    LimitOrderRequest request = LimitOrderRequest.gtc("yes", OrderSide.BUY, 0.5, 10, true);
    when(delegate.placeLimitOrder(request)).thenAnswer(inv -> {
      Thread.sleep(2_000);
      return OrderSubmission.placed("late");
    });

    OrderSubmission submission = gateway.placeLimitOrder(request);

    assertThat(submission.isPlaced()).isFalse();
    assertThat(submission.error().code()).isEqualTo(OrderError.TIMEOUT);
    assertThat(submission.error().timestamp()).isEqualTo(NOW);
    assertThat(output.getAll())
        .contains("WARN")
        .contains("placement GTC BUY 10.0@0.5 on yes got no answer");
  }

  @Test
  void answeredPlacementIsNotFlaggedAsUnanswered(CapturedOutput output) {
    LimitOrderRequest request = LimitOrderRequest.gtc("yes", OrderSide.BUY, 0.5, 10, true);
    when(delegate.placeLimitOrder(request)).thenReturn(OrderSubmission.placed("o1"));

    assertThat(gateway.placeLimitOrder(request).isPlaced()).isTrue();
    assertThat(output.getAll()).doesNotContain("got no answer");
  }

  @Test
  void fetchBooksKeepsRequestOrderAndSkipsDuplicates() {
    BookSummary a = new BookSummary(0.40, 0.42, 10, 10, 5);
    BookSummary b = new BookSummary(0.60, 0.62, 10, 10, 5);
    when(delegate.getBookSummary("a")).thenReturn(Optional.of(a));
    when(delegate.getBookSummary("b")).thenReturn(Optional.of(b));
    when(delegate.getBookSummary("c")).thenReturn(Optional.empty());

    Map<String, Optional<BookSummary>> books = gateway.fetchBooks(List.of("b", "a", "b", "c"));

    assertThat(books.keySet()).containsExactly("b", "a", "c");
    assertThat(books.get("a")).contains(a);
    assertThat(books.get("c")).isEmpty();
    verify(delegate, times(1)).getBookSummary("b");
  }
}
