package io.fleetgate.trust;

import io.fleetgate.error.AlreadyDecidedException;
import io.fleetgate.error.ConflictException;
import io.fleetgate.error.ConnectivityException;
import io.fleetgate.error.NotFoundException;
import io.fleetgate.model.FingerprintMatch;
import io.fleetgate.model.MinionIdentity;
import io.fleetgate.model.TrustState;
import io.fleetgate.storage.MinionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Lifecycle of minion identities: PENDING on first handshake, then exactly one operator decision.
 *
 * <p>Decisions are serialized per minion by a claim column taken with a conditional UPDATE. An
 * accept holds the claim across the backend admission call and commits ACCEPTED only after the
 * backend succeeded; a reject needs the claim to be free. No process-wide lock is held.
 */
public final class TrustLedger {
    private static final Logger log = LoggerFactory.getLogger(TrustLedger.class);
    private static final Pattern MINION_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]{0,254}$");
    private static final int MAX_FINGERPRINT_LENGTH = 512;

    private final MinionStore store;
    private final FingerprintVerifier verifier;
    private final TrustBackend backend;
    private final Clock clock;

    public TrustLedger(MinionStore store, FingerprintVerifier verifier, TrustBackend backend, Clock clock) {
        this.store = store;
        this.verifier = verifier;
        this.backend = backend;
        this.clock = clock;
    }

    public MinionIdentity recordPending(String minionId, String fingerprint) {
        String id = requireMinionId(minionId);
        String fp = requireFingerprint(fingerprint);
        if (store.insertPendingIfAbsent(id, fp, clock.millis())) {
            log.info("Recorded pending minion {}", id);
        }
        MinionIdentity existing = status(id);
        if (!FingerprintVerifier.normalize(existing.fingerprint()).equals(FingerprintVerifier.normalize(fp))) {
            log.warn("Handshake for {} presented a different fingerprint than the recorded one", id);
            throw new ConflictException("Minion " + id + " is already known with a different fingerprint");
        }
        return existing;
    }

    public MinionIdentity accept(String minionId, String fingerprint, String operator) {
        String id = requireMinionId(minionId);
        String fp = requireFingerprint(fingerprint);
        MinionIdentity current = status(id);
        if (current.state() != TrustState.PENDING) {
            throw new AlreadyDecidedException(id, current.state());
        }
        if (!FingerprintVerifier.normalize(current.fingerprint()).equals(FingerprintVerifier.normalize(fp))) {
            throw new ConflictException("Fingerprint does not match the handshake recorded for " + id);
        }
        String claimToken = UUID.randomUUID().toString();
        if (!store.tryClaimDecision(id, claimToken, clock.millis())) {
            throw new AlreadyDecidedException(id, currentState(id));
        }
        boolean committed = false;
        try {
            FingerprintMatch match = verifier.verify(id, fp);
            if (match == FingerprintMatch.MISMATCH) {
                throw new ConflictException("Fingerprint mismatch for " + id + ": the trust backend holds a different key");
            }
            if (match == FingerprintMatch.UNKNOWN) {
                throw new NotFoundException("Trust backend has no key for " + id);
            }
            admit(id);
            committed = store.commitAccepted(id, claimToken, operator, clock.millis());
            if (!committed) {
                log.error("Backend admitted {} but the decision claim was lost before commit", id);
                throw new AlreadyDecidedException(id, currentState(id));
            }
        } finally {
            if (!committed) {
                store.releaseClaim(id, claimToken, clock.millis());
            }
        }
        log.info("Accepted minion {} by {}", id, operator);
        return status(id);
    }

    public MinionIdentity reject(String minionId, String operator) {
        String id = requireMinionId(minionId);
        MinionIdentity current = status(id);
        if (current.state() != TrustState.PENDING) {
            throw new AlreadyDecidedException(id, current.state());
        }
        if (!store.tryReject(id, operator, clock.millis())) {
            throw new AlreadyDecidedException(id, currentState(id));
        }
        log.info("Rejected minion {} by {}", id, operator);
        return status(id);
    }

    public MinionIdentity status(String minionId) {
        return store.find(minionId)
                .orElseThrow(() -> new NotFoundException("Unknown minion: " + minionId));
    }

    public List<MinionIdentity> list(TrustState stateFilter, int limit) {
        return store.list(stateFilter, limit);
    }

    /** Releases decision claims older than {@code olderThan}; the holder is assumed dead. */
    public int recoverStaleClaims(Duration olderThan) {
        long now = clock.millis();
        int released = store.releaseStaleClaims(now - olderThan.toMillis(), now);
        if (released > 0) {
            log.warn("Released {} stale trust decision claim(s)", released);
        }
        return released;
    }

    private void admit(String minionId) {
        try {
            backend.admitToFleet(minionId);
        } catch (ConnectivityException e) {
            log.warn("Trust backend refused admission of {}: {}", minionId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.warn("Trust backend admission of {} failed: {}", minionId, e.getMessage());
            throw new ConnectivityException("Trust backend admission failed for " + minionId, e);
        }
    }

    private TrustState currentState(String minionId) {
        return store.find(minionId).map(MinionIdentity::state).orElse(null);
    }

    private static String requireMinionId(String minionId) {
        if (minionId == null || !MINION_ID.matcher(minionId.trim()).matches()) {
            throw new IllegalArgumentException("Invalid minion id: " + minionId);
        }
        return minionId.trim();
    }

    private static String requireFingerprint(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("fingerprint must not be blank");
        }
        String fp = fingerprint.trim();
        if (fp.length() > MAX_FINGERPRINT_LENGTH) {
            throw new IllegalArgumentException("fingerprint is too long");
        }
        return fp;
    }
}
