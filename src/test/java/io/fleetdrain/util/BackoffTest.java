package io.fleetdrain.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class BackoffTest {

    @Test
    void doublesUntilCapWithoutJitter() {
        Backoff backoff = new Backoff(1_000L, 30_000L, 0L);
        Assertions.assertEquals(1_000L, backoff.delayMs(1));
        Assertions.assertEquals(2_000L, backoff.delayMs(2));
        Assertions.assertEquals(4_000L, backoff.delayMs(3));
        Assertions.assertEquals(16_000L, backoff.delayMs(5));
        Assertions.assertEquals(30_000L, backoff.delayMs(6));
        Assertions.assertEquals(30_000L, backoff.delayMs(60));
    }

    @Test
    void jitterStaysWithinBoundAndCap() {
        Backoff backoff = new Backoff(1_000L, 5_000L, 500L);
        for (int i = 0; i < 200; i++) {
            long first = backoff.delayMs(1);
            Assertions.assertTrue(first >= 1_000L && first <= 1_500L, "delay " + first);
            Assertions.assertTrue(backoff.delayMs(10) <= 5_000L);
        }
    }

    @Test
    void rejectsInvalidBounds() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new Backoff(0L, 10L, 0L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new Backoff(100L, 10L, 0L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new Backoff(100L, 1_000L, 0L).delayMs(0));
    }

    @Test
    void cancellationKeepsFirstReason() {
        CancellationToken token = CancellationToken.none();
        Assertions.assertFalse(token.isCancelled());
        token.cancel("shutdown signal");
        token.cancel("second");
        Assertions.assertTrue(token.isCancelled());
        Assertions.assertEquals("shutdown signal", token.reason());
    }
}
