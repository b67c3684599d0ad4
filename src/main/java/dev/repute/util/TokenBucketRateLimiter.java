/* Repute © 2025 Repute Devs — MIT */
package dev.repute.util;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * In-memory, thread-safe token bucket rate limiter keyed by participant ID.
 *
 * <p>Each participant has a bucket holding at most {@code capacity} tokens, refilled at {@code
 * refillPerSec}. Buckets that stay full and untouched for the idle TTL are evicted so memory stays
 * bounded. Time comes from a monotonic source.
 */
public final class TokenBucketRateLimiter {
  private static final double FULL_EPSILON = 1e-9;
  private static final Duration DEFAULT_BUCKET_TTL = Duration.ofMinutes(5);

  private static final class Bucket {
    double tokens;
    long lastRefillNanos;
    long lastUsedNanos;

    Bucket(double tokens, long nowNanos) {
      this.tokens = tokens;
      this.lastRefillNanos = nowNanos;
      this.lastUsedNanos = nowNanos;
    }
  }

  private final Map<Long, Bucket> buckets = new ConcurrentHashMap<>();
  private final double capacity;
  private final double refillPerSec;
  private final long bucketTtlNanos;
  private final LongSupplier nanoTimeSource;
  private final AtomicLong nextCleanupNanos;

  /**
   * Creates a limiter.
   *
   * @param capacity burst size (at least {@code 1})
   * @param refillPerSec tokens regained per second (fractional allowed)
   */
  public TokenBucketRateLimiter(int capacity, double refillPerSec) {
    this(capacity, refillPerSec, DEFAULT_BUCKET_TTL, System::nanoTime);
  }

  TokenBucketRateLimiter(
      int capacity, double refillPerSec, Duration bucketTtl, LongSupplier nanoTimeSource) {
    Objects.requireNonNull(bucketTtl, "bucketTtl");
    this.nanoTimeSource = Objects.requireNonNull(nanoTimeSource, "nanoTimeSource");
    this.capacity = Math.max(1, capacity);
    this.refillPerSec = Math.max(0.0001, refillPerSec);
    this.bucketTtlNanos = Math.max(0L, bucketTtl.toNanos());
    long now = nanoTimeSource.getAsLong();
    this.nextCleanupNanos =
        new AtomicLong(bucketTtlNanos == 0 ? Long.MAX_VALUE : now + bucketTtlNanos);
  }

  /**
   * Consumes one token from the participant's bucket.
   *
   * @param participantId bucket owner
   * @return {@code true} if a token was available
   */
  public boolean tryAcquire(long participantId) {
    long nowNanos = nanoTimeSource.getAsLong();
    maybeCleanup(nowNanos);
    Bucket b = buckets.computeIfAbsent(participantId, k -> new Bucket(capacity, nowNanos));
    synchronized (b) {
      refill(b, nowNanos);
      if (b.tokens >= 1.0) {
        b.tokens -= 1.0;
        b.lastUsedNanos = nowNanos;
        return true;
      }
      return false;
    }
  }

  int bucketCount() {
    return buckets.size();
  }

  private void refill(Bucket bucket, long nowNanos) {
    long delta = nowNanos - bucket.lastRefillNanos;
    if (delta > 0L) {
      bucket.tokens = Math.min(capacity, bucket.tokens + delta / 1_000_000_000.0d * refillPerSec);
      bucket.lastRefillNanos = nowNanos;
    }
  }

  private void maybeCleanup(long nowNanos) {
    long next = nextCleanupNanos.get();
    if (nowNanos < next || !nextCleanupNanos.compareAndSet(next, nowNanos + bucketTtlNanos)) {
      return;
    }
    buckets
        .entrySet()
        .removeIf(
            entry -> {
              Bucket bucket = entry.getValue();
              synchronized (bucket) {
                refill(bucket, nowNanos);
                return bucket.tokens >= capacity - FULL_EPSILON
                    && nowNanos - bucket.lastUsedNanos >= bucketTtlNanos;
              }
            });
  }
}
