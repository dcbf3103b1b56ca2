package org.janelia.mediasync.dao;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import org.janelia.mediasync.model.ProviderRecord;
import org.janelia.mediasync.model.StorageBackendKind;

public class InMemoryProviderRecordDao implements ProviderRecordDao {

    private final Map<Long, ProviderRecord> records = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong(100L);

    @Override
    public ProviderRecord findById(Long id) {
        return records.get(id);
    }

    @Override
    public List<ProviderRecord> findAll() {
        return new ArrayList<>(records.values());
    }

    @Override
    public long countAll() {
        return records.size();
    }

    @Override
    public void save(ProviderRecord entity) {
        if (entity.getId() == null) {
            entity.setId(idSequence.incrementAndGet());
        }
        records.put(entity.getId(), entity);
    }

    @Override
    public boolean deleteById(Long id) {
        return records.remove(id) != null;
    }

    @Override
    public List<ProviderRecord> findEnabled() {
        return records.values().stream()
                .filter(ProviderRecord::isEnabled)
                .sorted((r1, r2) -> r1.getId().compareTo(r2.getId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<ProviderRecord> findEnabledByKind(StorageBackendKind kind) {
        return findEnabled().stream()
                .filter(r -> r.getKindCode() == kind.getCode())
                .collect(Collectors.toList());
    }

    @Override
    public void updateLastSyncDate(Long providerId, Date lastSyncDate) {
        ProviderRecord record = records.get(providerId);
        if (record != null) {
            record.setLastSyncDate(lastSyncDate);
        }
    }
}
