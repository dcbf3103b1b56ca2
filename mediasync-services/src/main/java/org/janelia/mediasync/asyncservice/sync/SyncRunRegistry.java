package org.janelia.mediasync.asyncservice.sync;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;

import org.janelia.mediasync.utils.CancellationSignal;

/**
 * Process wide registry of running syncs, at most one per provider, plus the last result of every provider.
 */
@ApplicationScoped
public class SyncRunRegistry {

    private final ConcurrentMap<Long, SyncRun> activeRuns = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, SyncResult> lastResults = new ConcurrentHashMap<>();

    /**
     * Atomically registers a new run for the provider.
     *
     * @param parentCancellation cancelling it also cancels the new run
     * @return the new run or empty if the provider already has a running sync
     */
    public Optional<SyncRun> tryRegister(Long providerId, CancellationSignal parentCancellation) {
        SyncRun syncRun = new SyncRun(this, providerId, parentCancellation.newLinkedSignal());
        SyncRun currentRun = activeRuns.putIfAbsent(providerId, syncRun);
        return currentRun == null ? Optional.of(syncRun) : Optional.empty();
    }

    public Optional<SyncRun> getActiveRun(Long providerId) {
        return Optional.ofNullable(activeRuns.get(providerId));
    }

    public boolean isRunning(Long providerId) {
        return activeRuns.containsKey(providerId);
    }

    /**
     * Signals the active run of the provider, if any, without waiting for it to stop.
     */
    public boolean cancel(Long providerId) {
        SyncRun syncRun = activeRuns.get(providerId);
        if (syncRun == null) {
            return false;
        }
        syncRun.cancel();
        return true;
    }

    void release(SyncRun syncRun) {
        activeRuns.remove(syncRun.getProviderId(), syncRun);
    }

    void recordResult(SyncResult syncResult) {
        lastResults.put(syncResult.getProviderId(), syncResult);
    }

    public Optional<SyncResult> getLastResult(Long providerId) {
        return Optional.ofNullable(lastResults.get(providerId));
    }
}
