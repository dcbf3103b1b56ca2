package org.janelia.mediasync.dao.mongo;

import java.util.Date;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import org.janelia.mediasync.cdi.qualifier.MediaSyncDefault;
import org.janelia.mediasync.dao.ProviderRecordDao;
import org.janelia.mediasync.dao.mongo.utils.TimebasedIdentifierGenerator;
import org.janelia.mediasync.model.ProviderRecord;
import org.janelia.mediasync.model.StorageBackendKind;

/**
 * Mongo based implementation of ProviderRecordDao.
 */
@ApplicationScoped
public class ProviderRecordMongoDao extends AbstractMongoDao<ProviderRecord, Long> implements ProviderRecordDao {

    private final TimebasedIdentifierGenerator idGenerator;

    @Inject
    public ProviderRecordMongoDao(MongoDatabase mongoDatabase,
                                  @MediaSyncDefault TimebasedIdentifierGenerator idGenerator) {
        super(mongoDatabase, "storageProvider", ProviderRecord.class);
        this.idGenerator = idGenerator;
    }

    @Override
    public List<ProviderRecord> findEnabled() {
        return find(Filters.eq("enabled", true), Sorts.ascending("_id"), 0, 0);
    }

    @Override
    public List<ProviderRecord> findEnabledByKind(StorageBackendKind kind) {
        return find(
                Filters.and(Filters.eq("enabled", true), Filters.eq("kindCode", kind.getCode())),
                Sorts.ascending("_id"),
                0,
                0);
    }

    @Override
    public void updateLastSyncDate(Long providerId, Date lastSyncDate) {
        mongoCollection.updateOne(Filters.eq("_id", providerId),
                lastSyncDate == null
                        ? Updates.unset("lastSyncDate")
                        : Updates.set("lastSyncDate", lastSyncDate.getTime()));
    }

    @Override
    protected Long generateId() {
        return idGenerator.generateId();
    }
}
