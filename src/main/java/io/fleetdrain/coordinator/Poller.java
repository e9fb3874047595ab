package io.fleetdrain.coordinator;

import io.fleetdrain.util.CancellationToken;
import io.fleetdrain.util.Ticker;

import java.util.function.LongFunction;
import java.util.function.Predicate;

public final class Poller {
    private Poller() {
    }

    public static <T> PollResult<T> poll(
            Ticker ticker,
            long intervalMs,
            long timeoutMs,
            CancellationToken token,
            LongFunction<T> attempt,
            Predicate<T> done
    ) {
        if (intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be positive: " + intervalMs);
        }
        long start = ticker.nowMs();
        int attempts = 0;
        T last = null;
        while (true) {
            if (token.isCancelled()) {
                return new PollResult<>(PollResult.Status.CANCELLED, last, attempts, ticker.nowMs() - start);
            }
            // Each attempt gets what is left before timeout + interval.
            last = attempt.apply(timeoutMs + intervalMs - (ticker.nowMs() - start));
            attempts++;
            if (done.test(last)) {
                return new PollResult<>(PollResult.Status.SATISFIED, last, attempts, ticker.nowMs() - start);
            }
            long elapsed = ticker.nowMs() - start;
            if (elapsed >= timeoutMs) {
                return new PollResult<>(PollResult.Status.TIMED_OUT, last, attempts, elapsed);
            }
            try {
                ticker.sleep(Math.min(intervalMs, timeoutMs - elapsed));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                token.cancel("interrupted");
                return new PollResult<>(PollResult.Status.CANCELLED, last, attempts, ticker.nowMs() - start);
            }
        }
    }

    public record PollResult<T>(Status status, T last, int attempts, long elapsedMs) {
        public enum Status {
            SATISFIED,
            TIMED_OUT,
            CANCELLED
        }

        public boolean satisfied() {
            return status == Status.SATISFIED;
        }
    }
}
