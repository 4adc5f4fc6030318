package io.fleetgate.trust;

import io.fleetgate.error.ConnectivityException;
import io.fleetgate.model.FingerprintMatch;

import java.util.Locale;
import java.util.Optional;

public final class FingerprintVerifier {
    private final TrustBackend backend;

    public FingerprintVerifier(TrustBackend backend) {
        this.backend = backend;
    }

    public FingerprintMatch verify(String minionId, String claimedFingerprint) {
        Optional<String> known;
        try {
            known = backend.lookupFingerprint(minionId);
        } catch (ConnectivityException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConnectivityException("Trust backend lookup failed for " + minionId, e);
        }
        if (known.isEmpty() || normalize(known.get()).isEmpty()) {
            return FingerprintMatch.UNKNOWN;
        }
        return normalize(known.get()).equals(normalize(claimedFingerprint))
                ? FingerprintMatch.MATCH
                : FingerprintMatch.MISMATCH;
    }

    /** Fingerprints compare case-insensitively with surrounding whitespace ignored. */
    public static String normalize(String fingerprint) {
        return fingerprint == null ? "" : fingerprint.trim().toLowerCase(Locale.ROOT);
    }
}
