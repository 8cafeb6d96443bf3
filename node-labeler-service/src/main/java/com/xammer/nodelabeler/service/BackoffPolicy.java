package com.xammer.nodelabeler.service;

import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff with jitter: attempt {@code n} waits a random time between half and
 * all of {@code initial * 2^(n-1)}, never more than {@code max}.
 */
public class BackoffPolicy {

    private final Duration initial;
    private final Duration max;
    private final Random random;

    public BackoffPolicy(Duration initial, Duration max, Random random) {
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial backoff must be positive");
        }
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max backoff must not be shorter than the initial backoff");
        }
        this.initial = initial;
        this.max = max;
        this.random = random;
    }

    /**
     * @param attempt 1 for the first retry
     */
    public Duration delayFor(int attempt) {
        long ceiling = ceilingMillis(Math.max(1, attempt));
        long half = ceiling / 2;
        long jitter = half == 0 ? 0 : (long) (random.nextDouble() * (ceiling - half + 1));
        return Duration.ofMillis(Math.min(ceiling, half + jitter));
    }

    private long ceilingMillis(int attempt) {
        long millis = initial.toMillis();
        long maxMillis = max.toMillis();
        for (int i = 1; i < attempt && millis < maxMillis; i++) {
            millis *= 2;
        }
        return Math.min(millis, maxMillis);
    }
}
