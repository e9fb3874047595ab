package io.fleetdrain.util;

import java.util.concurrent.atomic.AtomicReference;

public final class CancellationToken {
    private final AtomicReference<String> reason = new AtomicReference<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel(String why) {
        reason.compareAndSet(null, why == null || why.isBlank() ? "cancelled" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }
}
