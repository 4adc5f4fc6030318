package io.fleetgate.throttle;

import java.time.Duration;

public record ThrottleDecision(boolean allowed, Duration retryAfter) {
    private static final ThrottleDecision ALLOWED = new ThrottleDecision(true, Duration.ZERO);

    public static ThrottleDecision admitted() {
        return ALLOWED;
    }

    public static ThrottleDecision denied(Duration retryAfter) {
        return new ThrottleDecision(false, retryAfter);
    }
}
