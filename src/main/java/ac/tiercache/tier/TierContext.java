package ac.tiercache.tier;

import ac.tiercache.LastError;
import ac.tiercache.envelope.EnvelopeCodec;
import ac.tiercache.envelope.FileLocks;

import java.time.Clock;

/**
 * Collaborators shared by every tier of one engine.
 */
public final class TierContext {
    private final Clock clock;
    private final LastError lastError;
    private final String keyPrefix;
    private final EnvelopeCodec codec;
    private final FileLocks fileLocks;
    private final boolean connectionPooling;

    public TierContext(Clock clock, LastError lastError, String keyPrefix, EnvelopeCodec codec,
                       FileLocks fileLocks, boolean connectionPooling) {
        this.clock = clock;
        this.lastError = lastError;
        this.keyPrefix = keyPrefix != null ? keyPrefix : "";
        this.codec = codec;
        this.fileLocks = fileLocks;
        this.connectionPooling = connectionPooling;
    }

    public Clock getClock() { return clock; }
    public LastError getLastError() { return lastError; }
    public String getKeyPrefix() { return keyPrefix; }
    public EnvelopeCodec getCodec() { return codec; }
    public FileLocks getFileLocks() { return fileLocks; }
    public boolean isConnectionPooling() { return connectionPooling; }

    public long now() {
        return clock.instant().getEpochSecond();
    }
}
