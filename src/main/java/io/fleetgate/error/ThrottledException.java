package io.fleetgate.error;

import java.time.Duration;

public final class ThrottledException extends FleetGateException {
    private final String endpointClass;
    private final Duration retryAfter;

    public ThrottledException(String endpointClass, Duration retryAfter) {
        super("rate_limited", "Rate limit exceeded for " + endpointClass + ", retry after " + retryAfter.toMillis() + "ms");
        this.endpointClass = endpointClass;
        this.retryAfter = retryAfter;
    }

    public String endpointClass() {
        return endpointClass;
    }

    public Duration retryAfter() {
        return retryAfter;
    }

    /** Whole seconds for a Retry-After header, rounded up so clients never retry early. */
    public long retryAfterSeconds() {
        long ms = retryAfter.toMillis();
        return Math.max(1L, (ms + 999L) / 1000L);
    }
}
