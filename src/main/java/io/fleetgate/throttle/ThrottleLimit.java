package io.fleetgate.throttle;

public record ThrottleLimit(int limit, long windowMs) {
    public ThrottleLimit {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        if (windowMs < 1L) {
            throw new IllegalArgumentException("windowMs must be >= 1");
        }
    }
}
