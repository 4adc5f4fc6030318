package io.fleetgate.trust;

import java.util.Optional;

/**
 * Key-management side of the automation backend. Implementations report transport failures as
 * {@link io.fleetgate.error.ConnectivityException}.
 */
public interface TrustBackend {
    /** Fingerprint the backend currently holds for the minion's key, empty when it has none. */
    Optional<String> lookupFingerprint(String minionId);

    /** Admits the minion's key. Must be idempotent: admitting an admitted key is a success. */
    void admitToFleet(String minionId);
}
