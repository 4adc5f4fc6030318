package io.fleetgate.throttle;

import io.fleetgate.config.FleetSettings;
import io.fleetgate.error.ThrottledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sliding-window admission limiter keyed by {@code (endpointClass, clientKey)}.
 *
 * <p>Counts live in fixed windows aligned to the epoch; the estimate for "now" weights the
 * previous window by how much of it still overlaps the trailing window, plus the current count.
 * A call is admitted while that estimate plus the call stays within the class limit. Denied
 * calls are not counted. Each key is updated with a single {@link ConcurrentHashMap#compute} so concurrent
 * callers for the same key serialize without a global lock.
 */
public final class AdmissionThrottle {
    private static final Logger log = LoggerFactory.getLogger(AdmissionThrottle.class);

    private final Map<EndpointClass, ThrottleLimit> limits;
    private final ConcurrentMap<String, WindowCounter> counters;
    private final Map<EndpointClass, AtomicLong> deniedByClass;
    private final AtomicLong lastCleanupMs;

    public AdmissionThrottle(Map<EndpointClass, ThrottleLimit> limits) {
        EnumMap<EndpointClass, ThrottleLimit> copy = new EnumMap<>(EndpointClass.class);
        for (EndpointClass endpointClass : EndpointClass.values()) {
            ThrottleLimit limit = limits.get(endpointClass);
            if (limit == null) {
                throw new IllegalArgumentException("Missing throttle limit for " + endpointClass);
            }
            copy.put(endpointClass, limit);
        }
        this.limits = copy;
        this.counters = new ConcurrentHashMap<>();
        this.deniedByClass = new EnumMap<>(EndpointClass.class);
        for (EndpointClass endpointClass : EndpointClass.values()) {
            deniedByClass.put(endpointClass, new AtomicLong());
        }
        this.lastCleanupMs = new AtomicLong(Long.MIN_VALUE);
    }

    public static AdmissionThrottle fromSettings(FleetSettings settings) {
        long window = settings.throttleWindowMs();
        Map<EndpointClass, ThrottleLimit> limits = new EnumMap<>(EndpointClass.class);
        limits.put(EndpointClass.HANDSHAKE, new ThrottleLimit(settings.handshakeLimit(), window));
        limits.put(EndpointClass.TRUST_DECISION, new ThrottleLimit(settings.trustDecisionLimit(), window));
        limits.put(EndpointClass.COMMAND_DISPATCH, new ThrottleLimit(settings.commandDispatchLimit(), window));
        return new AdmissionThrottle(limits);
    }

    public ThrottleDecision allow(EndpointClass endpointClass, String clientKey, long nowMs) {
        ThrottleLimit limit = limits.get(endpointClass);
        long windowMs = limit.windowMs();
        long windowStartMs = nowMs - Math.floorMod(nowMs, windowMs);
        String key = endpointClass.name() + "|" + (clientKey == null || clientKey.isBlank() ? "unknown" : clientKey.trim());
        WindowCounter counter = counters.compute(key, (k, existing) -> {
            WindowCounter rolled = roll(existing, windowStartMs, windowMs);
            if (!fits(rolled.previous, rolled.current, limit.limit(), nowMs - rolled.windowStartMs, windowMs)) {
                return rolled.withAdmitted(false);
            }
            return new WindowCounter(windowStartMs, rolled.current + 1, rolled.previous, true);
        });
        cleanup(nowMs);
        if (counter.admitted) {
            return ThrottleDecision.admitted();
        }
        deniedByClass.get(endpointClass).incrementAndGet();
        Duration retryAfter = Duration.ofMillis(retryAfterMs(counter, limit.limit(), nowMs, windowMs));
        log.debug("Throttled {} for key {}, retry after {}ms", endpointClass.label(), key, retryAfter.toMillis());
        return ThrottleDecision.denied(retryAfter);
    }

    /** Same as {@link #allow} but throws {@link ThrottledException} when the call is denied. */
    public void acquire(EndpointClass endpointClass, String clientKey, long nowMs) {
        ThrottleDecision decision = allow(endpointClass, clientKey, nowMs);
        if (!decision.allowed()) {
            throw new ThrottledException(endpointClass.label(), decision.retryAfter());
        }
    }

    public Map<String, Long> deniedCounts() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (Map.Entry<EndpointClass, AtomicLong> e : deniedByClass.entrySet()) {
            out.put(e.getKey().label(), e.getValue().get());
        }
        return out;
    }

    public int trackedKeys() {
        return counters.size();
    }

    public ThrottleLimit limit(EndpointClass endpointClass) {
        return limits.get(endpointClass);
    }

    /**
     * Integer form of {@code previous * (1 - elapsed/window) + current + 1 <= limit}, so the
     * instant computed by {@link #retryAfterMs} is admitted exactly.
     */
    private static boolean fits(long previous, long current, long limit, long elapsedMs, long windowMs) {
        return previous * (windowMs - elapsedMs) + (current + 1L) * windowMs <= limit * windowMs;
    }

    /**
     * Time until the estimate first admits one more call, capped at one window. When the current
     * count alone is full, that instant lies in the next window, where the current count has
     * become the decaying previous one.
     */
    private static long retryAfterMs(WindowCounter counter, int limit, long nowMs, long windowMs) {
        long elapsedMs = nowMs - counter.windowStartMs;
        long waitMs;
        if (counter.current + 1L <= limit) {
            long spare = limit - 1L - counter.current;
            waitMs = earliestElapsedMs(counter.previous, spare, windowMs) - elapsedMs;
        } else {
            waitMs = windowMs - elapsedMs + earliestElapsedMs(counter.current, limit - 1L, windowMs);
        }
        return Math.max(1L, Math.min(windowMs, waitMs));
    }

    /** Smallest elapsed time at which {@code previous * (window - elapsed) <= spare * window}. */
    private static long earliestElapsedMs(long previous, long spare, long windowMs) {
        if (previous <= 0L) {
            return 0L;
        }
        return Math.max(0L, windowMs - (spare * windowMs) / previous);
    }

    private static WindowCounter roll(WindowCounter existing, long windowStartMs, long windowMs) {
        if (existing == null) {
            return new WindowCounter(windowStartMs, 0, 0, false);
        }
        if (existing.windowStartMs == windowStartMs) {
            return existing;
        }
        if (existing.windowStartMs == windowStartMs - windowMs) {
            return new WindowCounter(windowStartMs, 0, existing.current, false);
        }
        if (existing.windowStartMs > windowStartMs) {
            // Caller clock went backwards; keep the newer window.
            return existing;
        }
        return new WindowCounter(windowStartMs, 0, 0, false);
    }

    private void cleanup(long nowMs) {
        long longestWindow = 0L;
        for (ThrottleLimit limit : limits.values()) {
            longestWindow = Math.max(longestWindow, limit.windowMs());
        }
        long prev = lastCleanupMs.get();
        if (prev != Long.MIN_VALUE && nowMs - prev < longestWindow) {
            return;
        }
        if (!lastCleanupMs.compareAndSet(prev, nowMs)) {
            return;
        }
        long keepAfter = nowMs - 2L * longestWindow;
        counters.entrySet().removeIf(e -> e.getValue().windowStartMs < keepAfter);
    }

    private static final class WindowCounter {
        private final long windowStartMs;
        private final int current;
        private final int previous;
        private final boolean admitted;

        private WindowCounter(long windowStartMs, int current, int previous, boolean admitted) {
            this.windowStartMs = windowStartMs;
            this.current = current;
            this.previous = previous;
            this.admitted = admitted;
        }

        private WindowCounter withAdmitted(boolean value) {
            return new WindowCounter(windowStartMs, current, previous, value);
        }
    }
}
