package org.janelia.mediasync.asyncservice.sync;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Options of a sync run.
 */
public class SyncRequest {
    /**
     * Re-examine every known file regardless of skipExisting.
     */
    private boolean fullSync;
    private boolean removeDeleted = true;
    private boolean skipExisting = true;
    /**
     * Maximum number of new files added by one run; 0 means unlimited.
     */
    private int maxFiles;
    private String folderId;
    private boolean recursive = true;

    public boolean isFullSync() {
        return fullSync;
    }

    public SyncRequest setFullSync(boolean fullSync) {
        this.fullSync = fullSync;
        return this;
    }

    public boolean isRemoveDeleted() {
        return removeDeleted;
    }

    public SyncRequest setRemoveDeleted(boolean removeDeleted) {
        this.removeDeleted = removeDeleted;
        return this;
    }

    public boolean isSkipExisting() {
        return skipExisting;
    }

    public SyncRequest setSkipExisting(boolean skipExisting) {
        this.skipExisting = skipExisting;
        return this;
    }

    public int getMaxFiles() {
        return maxFiles;
    }

    public SyncRequest setMaxFiles(int maxFiles) {
        this.maxFiles = maxFiles;
        return this;
    }

    public String getFolderId() {
        return folderId;
    }

    public SyncRequest setFolderId(String folderId) {
        this.folderId = folderId;
        return this;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public SyncRequest setRecursive(boolean recursive) {
        this.recursive = recursive;
        return this;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("fullSync", fullSync)
                .append("removeDeleted", removeDeleted)
                .append("skipExisting", skipExisting)
                .append("maxFiles", maxFiles)
                .append("folderId", folderId)
                .append("recursive", recursive)
                .toString();
    }
}
