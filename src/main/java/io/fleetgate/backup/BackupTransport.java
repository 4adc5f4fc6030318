package io.fleetgate.backup;

import java.nio.file.Path;
import java.util.List;

/** Remote encrypted backup storage. Implementations never include secrets in returned details. */
public interface BackupTransport {
    ProbeResult probe(BackupSession session);

    /** Creates an encrypted repository keyed by the session passphrase. */
    TransportResult initialize(BackupSession session);

    /** Captures {@code sources} into a new archive; success only once the transport confirmed it. */
    TransportResult run(BackupSession session, String archiveName, List<Path> sources);

    TransportResult prune(BackupSession session, BackupRetention retention);
}
