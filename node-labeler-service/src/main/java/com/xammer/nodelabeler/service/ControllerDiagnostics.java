package com.xammer.nodelabeler.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-level state reported by the health endpoints. Only watch errors affect health,
 * individual node failures do not.
 */
public class ControllerDiagnostics {

    private final Clock clock;
    private final Duration errorWindow;
    private final AtomicBoolean ready = new AtomicBoolean(false);
    private final Deque<Instant> watchErrors = new ConcurrentLinkedDeque<>();
    private volatile Instant lastEvent;

    public ControllerDiagnostics(Clock clock, Duration errorWindow) {
        this.clock = clock;
        this.errorWindow = errorWindow;
        this.lastEvent = clock.instant();
    }

    public void markReady() {
        ready.set(true);
    }

    public void markNotReady() {
        ready.set(false);
    }

    public boolean isReady() {
        return ready.get();
    }

    public void recordEvent() {
        lastEvent = clock.instant();
    }

    public Instant getLastEvent() {
        return lastEvent;
    }

    public void recordWatchError() {
        watchErrors.addLast(clock.instant());
        evictExpired();
    }

    public int recentWatchErrors() {
        evictExpired();
        return watchErrors.size();
    }

    public boolean isHealthy() {
        return recentWatchErrors() == 0;
    }

    private void evictExpired() {
        Instant cutoff = clock.instant().minus(errorWindow);
        Instant head;
        while ((head = watchErrors.peekFirst()) != null && head.isBefore(cutoff)) {
            watchErrors.pollFirst();
        }
    }
}
