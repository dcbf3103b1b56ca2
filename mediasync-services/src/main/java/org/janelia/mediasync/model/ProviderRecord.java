package org.janelia.mediasync.model;

import java.util.Date;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Persisted configuration of one storage provider.
 */
public class ProviderRecord implements HasIdentifier<Long> {
    @JsonProperty("_id")
    private Long id;
    private int kindCode;
    private String name;
    private boolean enabled = true;
    /**
     * Opaque JSON configuration (credentials, root paths, etc.) interpreted only by the backend.
     */
    private String configuration;
    private Date lastSyncDate;

    @Override
    public Long getId() {
        return id;
    }

    @Override
    public void setId(Long id) {
        this.id = id;
    }

    @JsonIgnore
    public StorageBackendKind getKind() {
        return StorageBackendKind.fromCode(kindCode);
    }

    public void setKind(StorageBackendKind kind) {
        this.kindCode = kind.getCode();
    }

    public int getKindCode() {
        return kindCode;
    }

    public void setKindCode(int kindCode) {
        this.kindCode = kindCode;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfiguration() {
        return configuration;
    }

    public void setConfiguration(String configuration) {
        this.configuration = configuration;
    }

    public Date getLastSyncDate() {
        return lastSyncDate;
    }

    public void setLastSyncDate(Date lastSyncDate) {
        this.lastSyncDate = lastSyncDate;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("id", id)
                .append("kindCode", kindCode)
                .append("name", name)
                .append("enabled", enabled)
                .append("lastSyncDate", lastSyncDate)
                .toString();
    }
}
