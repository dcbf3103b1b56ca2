package org.janelia.mediasync.dao;

import java.util.Date;
import java.util.List;

import org.janelia.mediasync.model.ProviderRecord;
import org.janelia.mediasync.model.StorageBackendKind;

/**
 * Provider configuration store.
 */
public interface ProviderRecordDao extends ReadWriteDao<ProviderRecord, Long> {
    List<ProviderRecord> findEnabled();
    List<ProviderRecord> findEnabledByKind(StorageBackendKind kind);
    void updateLastSyncDate(Long providerId, Date lastSyncDate);
}
