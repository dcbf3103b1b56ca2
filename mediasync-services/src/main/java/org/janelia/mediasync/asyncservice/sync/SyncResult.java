package org.janelia.mediasync.asyncservice.sync;

import java.time.Duration;
import java.util.Collections;
import java.util.Date;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Outcome of one sync run.
 */
public class SyncResult {

    public static final String ALREADY_IN_PROGRESS = "A sync is already in progress for this provider";
    public static final String PROVIDER_NOT_FOUND = "Storage provider not found or disabled";
    public static final String CANCELLED = "Sync was cancelled";

    private final boolean success;
    private final boolean cancelled;
    private final Long providerId;
    private final String providerName;
    private final int filesAdded;
    private final int filesUpdated;
    private final int filesRemoved;
    private final int filesSkipped;
    private final int totalFilesFound;
    private final Date startTime;
    private final long durationMillis;
    private final String errorMessage;
    private final List<String> errors;

    private SyncResult(boolean success, boolean cancelled, Long providerId, String providerName,
                       int filesAdded, int filesUpdated, int filesRemoved, int filesSkipped, int totalFilesFound,
                       Date startTime, String errorMessage, List<String> errors) {
        this.success = success;
        this.cancelled = cancelled;
        this.providerId = providerId;
        this.providerName = providerName;
        this.filesAdded = filesAdded;
        this.filesUpdated = filesUpdated;
        this.filesRemoved = filesRemoved;
        this.filesSkipped = filesSkipped;
        this.totalFilesFound = totalFilesFound;
        this.startTime = startTime;
        this.durationMillis = Math.max(0L, System.currentTimeMillis() - startTime.getTime());
        this.errorMessage = errorMessage;
        this.errors = errors == null ? Collections.emptyList() : ImmutableList.copyOf(errors);
    }

    public static SyncResult successful(Long providerId, String providerName,
                                        int added, int updated, int removed, int skipped, int totalFilesFound,
                                        Date startTime, List<String> errors) {
        return new SyncResult(true, false, providerId, providerName, added, updated, removed, skipped, totalFilesFound,
                startTime, null, errors);
    }

    public static SyncResult failed(Long providerId, String providerName, String errorMessage, Date startTime) {
        return new SyncResult(false, false, providerId, providerName, 0, 0, 0, 0, 0, startTime, errorMessage, null);
    }

    public static SyncResult cancelled(Long providerId, String providerName, Date startTime) {
        return new SyncResult(false, true, providerId, providerName, 0, 0, 0, 0, 0, startTime, CANCELLED, null);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * A cancelled run is also unsuccessful and carries the {@link #CANCELLED} message.
     */
    public boolean isCancelled() {
        return cancelled;
    }

    public Long getProviderId() {
        return providerId;
    }

    public String getProviderName() {
        return providerName;
    }

    public int getFilesAdded() {
        return filesAdded;
    }

    public int getFilesUpdated() {
        return filesUpdated;
    }

    public int getFilesRemoved() {
        return filesRemoved;
    }

    public int getFilesSkipped() {
        return filesSkipped;
    }

    public int getTotalFilesFound() {
        return totalFilesFound;
    }

    public int getTotalFilesProcessed() {
        return filesAdded + filesUpdated + filesRemoved + filesSkipped;
    }

    public Date getStartTime() {
        return startTime;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    @JsonIgnore
    public Duration getDuration() {
        return Duration.ofMillis(durationMillis);
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Per file errors of an otherwise successful run.
     */
    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("providerId", providerId)
                .append("success", success)
                .append("filesAdded", filesAdded)
                .append("filesUpdated", filesUpdated)
                .append("filesRemoved", filesRemoved)
                .append("filesSkipped", filesSkipped)
                .append("totalFilesFound", totalFilesFound)
                .append("errorMessage", errorMessage)
                .toString();
    }
}
