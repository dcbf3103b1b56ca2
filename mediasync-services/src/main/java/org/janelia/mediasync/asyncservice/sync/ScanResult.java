package org.janelia.mediasync.asyncservice.sync;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.mediasync.dataservice.storage.FileDescriptor;

/**
 * Dry run report of what a sync would add.
 */
public class ScanResult {
    private final Long providerId;
    private final boolean success;
    private final int totalFilesFound;
    private final int newFilesCount;
    private final int existingFilesCount;
    private final long newFilesTotalSize;
    private final List<FileDescriptor> sampleNewFiles;
    private final String errorMessage;

    private ScanResult(Long providerId, boolean success, int totalFilesFound, int newFilesCount, int existingFilesCount,
                       long newFilesTotalSize, List<FileDescriptor> sampleNewFiles, String errorMessage) {
        this.providerId = providerId;
        this.success = success;
        this.totalFilesFound = totalFilesFound;
        this.newFilesCount = newFilesCount;
        this.existingFilesCount = existingFilesCount;
        this.newFilesTotalSize = newFilesTotalSize;
        this.sampleNewFiles = sampleNewFiles == null ? Collections.emptyList() : ImmutableList.copyOf(sampleNewFiles);
        this.errorMessage = errorMessage;
    }

    static ScanResult scanned(Long providerId, int totalFilesFound, int newFilesCount, long newFilesTotalSize,
                              List<FileDescriptor> sampleNewFiles) {
        return new ScanResult(providerId, true, totalFilesFound, newFilesCount, totalFilesFound - newFilesCount,
                newFilesTotalSize, sampleNewFiles, null);
    }

    static ScanResult failed(Long providerId, String errorMessage) {
        return new ScanResult(providerId, false, 0, 0, 0, 0L, null, errorMessage);
    }

    public Long getProviderId() {
        return providerId;
    }

    public boolean isSuccess() {
        return success;
    }

    public int getTotalFilesFound() {
        return totalFilesFound;
    }

    public int getNewFilesCount() {
        return newFilesCount;
    }

    public int getExistingFilesCount() {
        return existingFilesCount;
    }

    public long getNewFilesTotalSize() {
        return newFilesTotalSize;
    }

    public List<FileDescriptor> getSampleNewFiles() {
        return sampleNewFiles;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("providerId", providerId)
                .append("success", success)
                .append("totalFilesFound", totalFilesFound)
                .append("newFilesCount", newFilesCount)
                .append("errorMessage", errorMessage)
                .toString();
    }
}
