package io.fleetgate.throttle;

import io.fleetgate.config.FleetSettings;
import io.fleetgate.error.ThrottledException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

final class AdmissionThrottleTest {
    private static final long WINDOW_START = 1_760_000_040_000L - Math.floorMod(1_760_000_040_000L, 60_000L);

    @Test
    void sixthHandshakeInAWindowIsDeniedWithBoundedRetryAfter() {
        AdmissionThrottle throttle = AdmissionThrottle.fromSettings(FleetSettings.defaults());
        long now = WINDOW_START + 12_500L;
        for (int i = 0; i < 5; i++) {
            Assertions.assertTrue(throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.7", now + i).allowed(), "call " + i);
        }
        ThrottleDecision sixth = throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.7", now + 5);
        Assertions.assertFalse(sixth.allowed());
        Assertions.assertTrue(sixth.retryAfter().compareTo(Duration.ZERO) > 0);
        Assertions.assertTrue(sixth.retryAfter().compareTo(Duration.ofSeconds(60)) <= 0);
        // 47.495 s to the boundary, then 12 s until 5 * (1 - f) drops to 4.
        Assertions.assertEquals(Duration.ofMillis(59_495L), sixth.retryAfter());
        Assertions.assertEquals(1L, throttle.deniedCounts().get("handshake"));

        long retryAt = now + 5 + sixth.retryAfter().toMillis();
        Assertions.assertFalse(throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.7", retryAt - 1).allowed());
        Assertions.assertTrue(throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.7", retryAt).allowed());
    }

    @Test
    void waitingExactlyRetryAfterIsAdmitted() {
        long[] offsets = {12_000L, 12_500L, 20_001L, 33_333L, 45_000L, 59_999L};
        for (long offset : offsets) {
            AdmissionThrottle throttle = AdmissionThrottle.fromSettings(FleetSettings.defaults());
            long now = WINDOW_START + offset;
            for (int i = 0; i < 5; i++) {
                Assertions.assertTrue(throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.7", now).allowed());
            }
            ThrottleDecision denied = throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.7", now);
            Assertions.assertFalse(denied.allowed(), "offset " + offset);
            long retryAfter = denied.retryAfter().toMillis();
            Assertions.assertTrue(retryAfter > 0 && retryAfter <= 60_000L, "offset " + offset + ": " + retryAfter);
            Assertions.assertTrue(throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.7", now + retryAfter).allowed(),
                    "offset " + offset + " retryAfter " + retryAfter);
        }
    }

    @Test
    void retryAfterIsCappedAtOneWindow() {
        AdmissionThrottle throttle = AdmissionThrottle.fromSettings(FleetSettings.defaults());
        for (int i = 0; i < 5; i++) {
            throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.7", WINDOW_START);
        }
        ThrottleDecision denied = throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.7", WINDOW_START);
        Assertions.assertEquals(Duration.ofSeconds(60), denied.retryAfter());
    }

    @Test
    void classesAndClientKeysAreIndependent() {
        AdmissionThrottle throttle = AdmissionThrottle.fromSettings(FleetSettings.defaults());
        long now = WINDOW_START + 1_000L;
        for (int i = 0; i < 5; i++) {
            throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.7", now);
        }
        Assertions.assertFalse(throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.7", now).allowed());
        Assertions.assertTrue(throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.8", now).allowed());
        Assertions.assertTrue(throttle.allow(EndpointClass.TRUST_DECISION, "10.0.0.7", now).allowed());
        Assertions.assertTrue(throttle.allow(EndpointClass.COMMAND_DISPATCH, "10.0.0.7", now).allowed());
        Assertions.assertEquals(0L, throttle.deniedCounts().get("trust_decision"));
        Assertions.assertEquals(4, throttle.trackedKeys());
    }

    @Test
    void deniedCallsDoNotConsumeBudget() {
        AdmissionThrottle throttle = AdmissionThrottle.fromSettings(FleetSettings.defaults());
        long now = WINDOW_START + 59_000L;
        for (int i = 0; i < 5; i++) {
            throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.7", now);
        }
        for (int i = 0; i < 50; i++) {
            Assertions.assertFalse(throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.7", now).allowed());
        }
        // Had the denied calls counted, the previous window would still weigh over 9 here.
        long later = WINDOW_START + 60_000L + 50_000L;
        Assertions.assertTrue(throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.7", later).allowed());
        Assertions.assertEquals(50L, throttle.deniedCounts().get("handshake"));
    }

    @Test
    void previousWindowWeighsIntoTheEstimate() {
        AdmissionThrottle throttle = AdmissionThrottle.fromSettings(FleetSettings.defaults());
        for (int i = 0; i < 5; i++) {
            Assertions.assertTrue(throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.9", WINDOW_START + 59_000L).allowed());
        }
        // 10% into the next window: 5 * 0.9 = 4.5 already counted, so no new call fits.
        ThrottleDecision early = throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.9", WINDOW_START + 66_000L);
        Assertions.assertFalse(early.allowed());
        // At 20% of the window the previous count has decayed to 4.
        Assertions.assertEquals(Duration.ofMillis(6_000L), early.retryAfter());
        Assertions.assertFalse(throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.9", WINDOW_START + 71_999L).allowed());
        Assertions.assertTrue(throttle.allow(EndpointClass.HANDSHAKE, "10.0.0.9", WINDOW_START + 72_000L).allowed());
    }

    @Test
    void acquireRaisesThrottledExceptionWithRetryAfterSeconds() {
        AdmissionThrottle throttle = AdmissionThrottle.fromSettings(FleetSettings.defaults());
        long now = WINDOW_START + 30_200L;
        for (int i = 0; i < 10; i++) {
            throttle.acquire(EndpointClass.TRUST_DECISION, "10.0.0.7", now);
        }
        ThrottledException e = Assertions.assertThrows(ThrottledException.class,
                () -> throttle.acquire(EndpointClass.TRUST_DECISION, "10.0.0.7", now));
        Assertions.assertEquals("rate_limited", e.code());
        Assertions.assertEquals("trust_decision", e.endpointClass());
        Assertions.assertEquals(Duration.ofMillis(35_800L), e.retryAfter());
        Assertions.assertEquals(36L, e.retryAfterSeconds());
    }

    @Test
    void concurrentCallersNeverExceedTheLimit() throws Exception {
        AdmissionThrottle throttle = AdmissionThrottle.fromSettings(FleetSettings.defaults());
        long now = WINDOW_START + 5_000L;
        AtomicInteger admitted = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Void>> calls = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                calls.add(() -> {
                    if (throttle.allow(EndpointClass.COMMAND_DISPATCH, "alice", now).allowed()) {
                        admitted.incrementAndGet();
                    }
                    return null;
                });
            }
            for (Future<Void> f : pool.invokeAll(calls)) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }
        Assertions.assertEquals(30, admitted.get());
        Assertions.assertEquals(170L, throttle.deniedCounts().get("command_dispatch"));
    }

    @Test
    void limitsComeFromSettings() {
        AdmissionThrottle throttle = AdmissionThrottle.fromSettings(FleetSettings.defaults());
        Assertions.assertEquals(new ThrottleLimit(5, 60_000L), throttle.limit(EndpointClass.HANDSHAKE));
        Assertions.assertEquals(new ThrottleLimit(10, 60_000L), throttle.limit(EndpointClass.TRUST_DECISION));
        Assertions.assertEquals(new ThrottleLimit(30, 60_000L), throttle.limit(EndpointClass.COMMAND_DISPATCH));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ThrottleLimit(0, 60_000L));
    }
}
