package org.janelia.mediasync.dataservice.storage;

import org.apache.commons.lang3.builder.ToStringBuilder;

public class UploadResult {
    private final boolean success;
    private final String fileId;
    private final String fileName;
    private final long size;
    private final String contentType;
    private final String errorMessage;

    private UploadResult(boolean success, String fileId, String fileName, long size, String contentType, String errorMessage) {
        this.success = success;
        this.fileId = fileId;
        this.fileName = fileName;
        this.size = size;
        this.contentType = contentType;
        this.errorMessage = errorMessage;
    }

    public static UploadResult uploaded(String fileId, String fileName, long size, String contentType) {
        return new UploadResult(true, fileId, fileName, size, contentType, null);
    }

    public static UploadResult failed(String errorMessage) {
        return new UploadResult(false, null, null, 0L, null, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * For a local backend this is the path relative to the storage root, using '/' as separator.
     */
    public String getFileId() {
        return fileId;
    }

    public String getFileName() {
        return fileName;
    }

    public long getSize() {
        return size;
    }

    public String getContentType() {
        return contentType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("success", success)
                .append("fileId", fileId)
                .append("size", size)
                .append("errorMessage", errorMessage)
                .toString();
    }
}
