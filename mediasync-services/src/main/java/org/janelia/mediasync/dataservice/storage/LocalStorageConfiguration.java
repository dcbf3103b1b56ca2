package org.janelia.mediasync.dataservice.storage;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Configuration blob of a local storage provider.
 */
public class LocalStorageConfiguration {
    private String basePath;
    private boolean organizeByDate = true;
    private boolean watchForChanges = true;

    public LocalStorageConfiguration() {
    }

    public LocalStorageConfiguration(String basePath) {
        this.basePath = basePath;
    }

    public String getBasePath() {
        return basePath;
    }

    public void setBasePath(String basePath) {
        this.basePath = basePath;
    }

    public boolean isOrganizeByDate() {
        return organizeByDate;
    }

    public void setOrganizeByDate(boolean organizeByDate) {
        this.organizeByDate = organizeByDate;
    }

    public boolean isWatchForChanges() {
        return watchForChanges;
    }

    public void setWatchForChanges(boolean watchForChanges) {
        this.watchForChanges = watchForChanges;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("basePath", basePath)
                .append("organizeByDate", organizeByDate)
                .append("watchForChanges", watchForChanges)
                .toString();
    }
}
