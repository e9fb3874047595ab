package io.fleetdrain.util;

import java.time.Instant;

public interface Ticker {
    long nowMs();

    void sleep(long millis) throws InterruptedException;

    default Instant now() {
        return Instant.ofEpochMilli(nowMs());
    }

    static Ticker system() {
        return SystemTicker.INSTANCE;
    }
}
