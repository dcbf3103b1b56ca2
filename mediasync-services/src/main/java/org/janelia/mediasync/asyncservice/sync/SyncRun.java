package org.janelia.mediasync.asyncservice.sync;

import java.util.Date;

import org.janelia.mediasync.utils.CancellationSignal;

/**
 * The in-memory registration of a running sync. Closing the run removes it from the {@link SyncRunRegistry}.
 * Progress is published as an immutable snapshot so concurrent readers never see a partially updated state.
 */
public class SyncRun implements AutoCloseable {

    private final SyncRunRegistry registry;
    private final Long providerId;
    private final CancellationSignal cancellation;
    private final Date startTime;
    private volatile SyncStatus status;

    SyncRun(SyncRunRegistry registry, Long providerId, CancellationSignal cancellation) {
        this.registry = registry;
        this.providerId = providerId;
        this.cancellation = cancellation;
        this.startTime = new Date();
        this.status = new SyncStatus(providerId, true, 0, "Starting...", 0, 0, startTime, null);
    }

    public Long getProviderId() {
        return providerId;
    }

    public CancellationSignal getCancellation() {
        return cancellation;
    }

    public Date getStartTime() {
        return startTime;
    }

    public SyncStatus getStatus() {
        return status;
    }

    void updateProgress(int percent, String currentOperation, int filesProcessed, int totalFiles) {
        status = new SyncStatus(providerId, true, percent, currentOperation, filesProcessed, totalFiles, startTime, null);
    }

    void cancel() {
        cancellation.cancel();
    }

    @Override
    public void close() {
        registry.release(this);
    }
}
