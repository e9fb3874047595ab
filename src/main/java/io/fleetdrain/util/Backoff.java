package io.fleetdrain.util;

import java.util.concurrent.ThreadLocalRandom;

public final class Backoff {
    private final long baseMs;
    private final long maxMs;
    private final long jitterMs;

    public Backoff(long baseMs, long maxMs, long jitterMs) {
        if (baseMs <= 0L) {
            throw new IllegalArgumentException("baseMs must be positive: " + baseMs);
        }
        if (maxMs < baseMs) {
            throw new IllegalArgumentException("maxMs must be >= baseMs (base=" + baseMs + ", max=" + maxMs + ")");
        }
        this.baseMs = baseMs;
        this.maxMs = maxMs;
        this.jitterMs = Math.max(0L, jitterMs);
    }

    public long delayMs(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive: " + attempt);
        }
        long backoff = baseMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxMs / 2L) {
                backoff = maxMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxMs);
        long jitter = jitterMs == 0L ? 0L : ThreadLocalRandom.current().nextLong(0L, jitterMs + 1L);
        return Math.min(maxMs, backoff + jitter);
    }

    public long baseMs() {
        return baseMs;
    }

    public long maxMs() {
        return maxMs;
    }
}
