package io.fleetgate.trust;

import io.fleetgate.error.ConnectivityException;
import io.fleetgate.model.FingerprintMatch;
import io.fleetgate.support.FakeTrustBackend;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Optional;

final class FingerprintVerifierTest {

    @Test
    void comparesIgnoringCaseAndSurroundingWhitespace() {
        FakeTrustBackend backend = new FakeTrustBackend().withKey("web-01", "AB:CD:EF:01");
        FingerprintVerifier verifier = new FingerprintVerifier(backend);
        Assertions.assertEquals(FingerprintMatch.MATCH, verifier.verify("web-01", " ab:cd:ef:01 \n"));
        Assertions.assertEquals(FingerprintMatch.MISMATCH, verifier.verify("web-01", "ab:cd:ef:02"));
        Assertions.assertEquals(FingerprintMatch.UNKNOWN, verifier.verify("web-02", "ab:cd:ef:01"));
    }

    @Test
    void separatorsAreSignificant() {
        FingerprintVerifier verifier = new FingerprintVerifier(new FakeTrustBackend().withKey("web-01", "AB:CD:EF:01"));
        Assertions.assertEquals(FingerprintMatch.MISMATCH, verifier.verify("web-01", "abcdef01"));
        Assertions.assertEquals(FingerprintMatch.MISMATCH, verifier.verify("web-01", "ab:cd: ef:01"));
        Assertions.assertEquals("ab:cd:ef:01", FingerprintVerifier.normalize("\tAB:CD:EF:01 "));
    }

    @Test
    void blankBackendFingerprintCountsAsUnknown() {
        FingerprintVerifier verifier = new FingerprintVerifier(new TrustBackend() {
            @Override
            public Optional<String> lookupFingerprint(String minionId) {
                return Optional.of("   ");
            }

            @Override
            public void admitToFleet(String minionId) {
            }
        });
        Assertions.assertEquals(FingerprintMatch.UNKNOWN, verifier.verify("web-01", "ab"));
    }

    @Test
    void unexpectedBackendFailureSurfacesAsConnectivity() {
        FingerprintVerifier verifier = new FingerprintVerifier(new TrustBackend() {
            @Override
            public Optional<String> lookupFingerprint(String minionId) {
                throw new IllegalStateException("socket closed");
            }

            @Override
            public void admitToFleet(String minionId) {
            }
        });
        ConnectivityException e = Assertions.assertThrows(ConnectivityException.class, () -> verifier.verify("web-01", "ab"));
        Assertions.assertEquals("backend_unavailable", e.code());

        FakeTrustBackend down = new FakeTrustBackend();
        down.setUnreachable(true);
        Assertions.assertThrows(ConnectivityException.class, () -> new FingerprintVerifier(down).verify("web-01", "ab"));
    }
}
