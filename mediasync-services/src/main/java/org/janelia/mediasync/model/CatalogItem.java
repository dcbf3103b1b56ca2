package org.janelia.mediasync.model;

import java.util.Date;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * A media file known to the catalog. (providerId, remoteFileId) is unique; a null providerId
 * marks content whose provider was removed while its files were kept.
 */
public class CatalogItem implements HasIdentifier<Long> {
    @JsonProperty("_id")
    private Long id;
    private Long providerId;
    private String remoteFileId;
    private String fileName;
    private String localPath;
    private long size;
    private MediaKind mediaKind;
    private String contentType;
    private String contentHash;
    private Date dateTaken;
    private Date firstSeenDate;
    private Date lastSeenDate;

    @Override
    public Long getId() {
        return id;
    }

    @Override
    public void setId(Long id) {
        this.id = id;
    }

    public Long getProviderId() {
        return providerId;
    }

    public void setProviderId(Long providerId) {
        this.providerId = providerId;
    }

    public String getRemoteFileId() {
        return remoteFileId;
    }

    public void setRemoteFileId(String remoteFileId) {
        this.remoteFileId = remoteFileId;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public String getLocalPath() {
        return localPath;
    }

    public void setLocalPath(String localPath) {
        this.localPath = localPath;
    }

    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    public MediaKind getMediaKind() {
        return mediaKind;
    }

    public void setMediaKind(MediaKind mediaKind) {
        this.mediaKind = mediaKind;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public String getContentHash() {
        return contentHash;
    }

    public void setContentHash(String contentHash) {
        this.contentHash = contentHash;
    }

    public Date getDateTaken() {
        return dateTaken;
    }

    public void setDateTaken(Date dateTaken) {
        this.dateTaken = dateTaken;
    }

    public Date getFirstSeenDate() {
        return firstSeenDate;
    }

    public void setFirstSeenDate(Date firstSeenDate) {
        this.firstSeenDate = firstSeenDate;
    }

    public Date getLastSeenDate() {
        return lastSeenDate;
    }

    public void setLastSeenDate(Date lastSeenDate) {
        this.lastSeenDate = lastSeenDate;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("id", id)
                .append("providerId", providerId)
                .append("remoteFileId", remoteFileId)
                .append("size", size)
                .toString();
    }
}
