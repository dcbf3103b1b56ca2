package org.janelia.mediasync.asyncservice.sync;

import java.util.Date;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Immutable snapshot of the sync state of a provider.
 */
public class SyncStatus {
    private final Long providerId;
    private final boolean inProgress;
    private final int progressPercent;
    private final String currentOperation;
    private final int filesProcessed;
    private final int totalFiles;
    private final Date startTime;
    private final SyncResult lastSyncResult;

    SyncStatus(Long providerId, boolean inProgress, int progressPercent, String currentOperation,
               int filesProcessed, int totalFiles, Date startTime, SyncResult lastSyncResult) {
        this.providerId = providerId;
        this.inProgress = inProgress;
        this.progressPercent = progressPercent;
        this.currentOperation = currentOperation;
        this.filesProcessed = filesProcessed;
        this.totalFiles = totalFiles;
        this.startTime = startTime;
        this.lastSyncResult = lastSyncResult;
    }

    static SyncStatus idle(Long providerId, SyncResult lastSyncResult) {
        return new SyncStatus(providerId, false, lastSyncResult == null ? 0 : 100, null, 0, 0, null, lastSyncResult);
    }

    public Long getProviderId() {
        return providerId;
    }

    public boolean isInProgress() {
        return inProgress;
    }

    public int getProgressPercent() {
        return progressPercent;
    }

    public String getCurrentOperation() {
        return currentOperation;
    }

    public int getFilesProcessed() {
        return filesProcessed;
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public Date getStartTime() {
        return startTime;
    }

    /**
     * Only set when no run is in progress.
     */
    public SyncResult getLastSyncResult() {
        return lastSyncResult;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("providerId", providerId)
                .append("inProgress", inProgress)
                .append("progressPercent", progressPercent)
                .append("currentOperation", currentOperation)
                .append("filesProcessed", filesProcessed)
                .append("totalFiles", totalFiles)
                .toString();
    }
}
