package org.janelia.mediasync.model;

import java.util.Date;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Bookkeeping row of the content cache. The content hash is the identifier.
 */
public class CacheEntry implements HasIdentifier<String> {
    @JsonProperty("_id")
    private String hash;
    private String localPath;
    private long size;
    private String originReference;
    private Long providerId;
    private String providerFileId;
    private String contentType;
    private Date cachedDate;
    private Date lastAccessedDate;
    private int accessCount;

    @JsonIgnore
    @Override
    public String getId() {
        return hash;
    }

    @Override
    public void setId(String id) {
        this.hash = id;
    }

    public String getHash() {
        return hash;
    }

    public void setHash(String hash) {
        this.hash = hash;
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

    public String getOriginReference() {
        return originReference;
    }

    public void setOriginReference(String originReference) {
        this.originReference = originReference;
    }

    public Long getProviderId() {
        return providerId;
    }

    public void setProviderId(Long providerId) {
        this.providerId = providerId;
    }

    public String getProviderFileId() {
        return providerFileId;
    }

    public void setProviderFileId(String providerFileId) {
        this.providerFileId = providerFileId;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public Date getCachedDate() {
        return cachedDate;
    }

    public void setCachedDate(Date cachedDate) {
        this.cachedDate = cachedDate;
    }

    public Date getLastAccessedDate() {
        return lastAccessedDate;
    }

    public void setLastAccessedDate(Date lastAccessedDate) {
        this.lastAccessedDate = lastAccessedDate;
    }

    public int getAccessCount() {
        return accessCount;
    }

    public void setAccessCount(int accessCount) {
        this.accessCount = accessCount;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("hash", hash)
                .append("size", size)
                .append("localPath", localPath)
                .append("lastAccessedDate", lastAccessedDate)
                .toString();
    }
}
