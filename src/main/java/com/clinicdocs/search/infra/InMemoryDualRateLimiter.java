package com.clinicdocs.search.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-key limiter with two budgets refilled every minute: request count and volume units.
 */
public class InMemoryDualRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> requestBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> volumeBuckets = new ConcurrentHashMap<>();

    private final int requestsPerMinute;
    private final int volumePerMinute;

    public InMemoryDualRateLimiter(int requestsPerMinute, int volumePerMinute) {
        if (requestsPerMinute < 1 || volumePerMinute < 1) {
            throw new IllegalArgumentException("Rate limits must be positive");
        }
        this.requestsPerMinute = requestsPerMinute;
        this.volumePerMinute = volumePerMinute;
    }

    private static Bucket perMinute(int capacity) {
        return Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(capacity)
                .refillGreedy(capacity, Duration.ofMinutes(1))
                .build())
            .build();
    }

    @Override
    public void acquire(String key, int volume) {
        Bucket requests = requestBuckets.computeIfAbsent(key, k -> perMinute(requestsPerMinute));
        Bucket volumeBucket = volumeBuckets.computeIfAbsent(key, k -> perMinute(volumePerMinute));

        // a single oversized request may use the whole budget but never more
        long units = Math.max(1, Math.min(volume, volumePerMinute));
        try {
            requests.asBlocking().consume(1);
            volumeBucket.asBlocking().consume(units);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for rate limit on " + key);
        }
    }
}
