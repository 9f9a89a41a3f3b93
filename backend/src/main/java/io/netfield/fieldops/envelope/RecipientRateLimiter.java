package io.netfield.fieldops.envelope;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Per-recipient send budget for the dispatch loop, counted in one-minute windows. A recipient over
 * budget has its envelopes deferred until the window closes, without spending an attempt.
 */
@Component
public class RecipientRateLimiter {

  private static final Duration WINDOW = Duration.ofMinutes(1);

  private final int limitPerMinute;
  private final Cache<String, AtomicInteger> counters;

  @Autowired
  public RecipientRateLimiter(DispatchProperties properties) {
    this(properties.recipientLimitPerMinute(), Ticker.systemTicker());
  }

  RecipientRateLimiter(int limitPerMinute, Ticker ticker) {
    this.limitPerMinute = limitPerMinute;
    this.counters =
        Caffeine.newBuilder().expireAfterWrite(WINDOW).maximumSize(10_000).ticker(ticker).build();
  }

  /** Returns true and consumes one slot if the recipient is still under its limit. */
  public boolean tryAcquire(String recipientAddress) {
    if (limitPerMinute <= 0) {
      return true;
    }
    var counter = counters.get(recipientAddress, k -> new AtomicInteger(0));
    if (counter.incrementAndGet() > limitPerMinute) {
      counter.decrementAndGet();
      return false;
    }
    return true;
  }

  /** Time until the recipient's current window closes, or a full window if none is open. */
  public Duration retryAfter(String recipientAddress) {
    return counters
        .policy()
        .expireAfterWrite()
        .flatMap(expiration -> expiration.ageOf(recipientAddress))
        .map(WINDOW::minus)
        .filter(remaining -> !remaining.isNegative())
        .orElse(WINDOW);
  }
}
