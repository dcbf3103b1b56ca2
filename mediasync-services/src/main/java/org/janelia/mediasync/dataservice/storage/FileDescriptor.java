package org.janelia.mediasync.dataservice.storage;

import java.util.Date;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.mediasync.model.MediaKind;

/**
 * A file as reported by a storage backend listing.
 */
public class FileDescriptor {

    public static class Builder {
        private final String remoteFileId;
        private String fileName;
        private String fullPath;
        private long size;
        private MediaKind mediaKind = MediaKind.PHOTO;
        private String contentType;
        private Date createdDate;
        private Date modifiedDate;
        private boolean folder;
        private String parentFolderId;

        public Builder(String remoteFileId) {
            this.remoteFileId = remoteFileId;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder fullPath(String fullPath) {
            this.fullPath = fullPath;
            return this;
        }

        public Builder size(long size) {
            this.size = size;
            return this;
        }

        public Builder mediaKind(MediaKind mediaKind) {
            this.mediaKind = mediaKind;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder createdDate(Date createdDate) {
            this.createdDate = createdDate;
            return this;
        }

        public Builder modifiedDate(Date modifiedDate) {
            this.modifiedDate = modifiedDate;
            return this;
        }

        public Builder folder(boolean folder) {
            this.folder = folder;
            return this;
        }

        public Builder parentFolderId(String parentFolderId) {
            this.parentFolderId = parentFolderId;
            return this;
        }

        public FileDescriptor build() {
            return new FileDescriptor(this);
        }
    }

    private final String remoteFileId;
    private final String fileName;
    private final String fullPath;
    private final long size;
    private final MediaKind mediaKind;
    private final String contentType;
    private final Date createdDate;
    private final Date modifiedDate;
    private final boolean folder;
    private final String parentFolderId;

    private FileDescriptor(Builder builder) {
        this.remoteFileId = builder.remoteFileId;
        this.fileName = builder.fileName;
        this.fullPath = builder.fullPath;
        this.size = builder.size;
        this.mediaKind = builder.mediaKind;
        this.contentType = builder.contentType;
        this.createdDate = builder.createdDate;
        this.modifiedDate = builder.modifiedDate;
        this.folder = builder.folder;
        this.parentFolderId = builder.parentFolderId;
    }

    public static Builder builder(String remoteFileId) {
        return new Builder(remoteFileId);
    }

    public String getRemoteFileId() {
        return remoteFileId;
    }

    public String getFileName() {
        return fileName;
    }

    public String getFullPath() {
        return fullPath;
    }

    public long getSize() {
        return size;
    }

    public MediaKind getMediaKind() {
        return mediaKind;
    }

    public String getContentType() {
        return contentType;
    }

    public Date getCreatedDate() {
        return createdDate;
    }

    public Date getModifiedDate() {
        return modifiedDate;
    }

    public boolean isFolder() {
        return folder;
    }

    public String getParentFolderId() {
        return parentFolderId;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("remoteFileId", remoteFileId)
                .append("size", size)
                .append("mediaKind", mediaKind)
                .toString();
    }
}
