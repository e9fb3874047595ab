package io.fleetdrain.coordinator;

import io.fleetdrain.util.Backoff;
import io.fleetdrain.util.CancellationToken;
import io.fleetdrain.util.Ticker;

import java.util.function.Predicate;
import java.util.function.Supplier;

public final class Retrier {
    private Retrier() {
    }

    public static <T> RetryResult<T> retry(
            Ticker ticker,
            Backoff backoff,
            int maxAttempts,
            CancellationToken token,
            Supplier<T> call,
            Predicate<T> retryable
    ) {
        int bound = Math.max(1, maxAttempts);
        T last = null;
        for (int attempt = 1; attempt <= bound; attempt++) {
            if (attempt > 1) {
                try {
                    ticker.sleep(backoff.delayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    token.cancel("interrupted");
                }
                if (token.isCancelled()) {
                    return new RetryResult<>(last, attempt - 1, true, false);
                }
            }
            last = call.get();
            if (!retryable.test(last)) {
                return new RetryResult<>(last, attempt, false, false);
            }
        }
        return new RetryResult<>(last, bound, false, true);
    }

    public record RetryResult<T>(T last, int attempts, boolean cancelled, boolean exhausted) {
    }
}
