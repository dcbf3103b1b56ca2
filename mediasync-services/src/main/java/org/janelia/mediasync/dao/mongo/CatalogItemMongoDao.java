package org.janelia.mediasync.dao.mongo;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.google.common.collect.ImmutableList;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexModel;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Updates;
import org.janelia.mediasync.cdi.qualifier.BoolPropertyValue;
import org.janelia.mediasync.cdi.qualifier.MediaSyncDefault;
import org.janelia.mediasync.dao.CatalogItemDao;
import org.janelia.mediasync.dao.mongo.utils.TimebasedIdentifierGenerator;
import org.janelia.mediasync.model.CatalogItem;

/**
 * Mongo based implementation of CatalogItemDao.
 */
@ApplicationScoped
public class CatalogItemMongoDao extends AbstractMongoDao<CatalogItem, Long> implements CatalogItemDao {

    private final TimebasedIdentifierGenerator idGenerator;

    @Inject
    public CatalogItemMongoDao(MongoDatabase mongoDatabase,
                               @MediaSyncDefault TimebasedIdentifierGenerator idGenerator,
                               @BoolPropertyValue(name = "MongoDB.createCollectionIndexes", defaultValue = true) boolean createCollectionIndexes) {
        super(mongoDatabase, "catalogItem", CatalogItem.class);
        this.idGenerator = idGenerator;
        if (createCollectionIndexes) {
            mongoCollection.createIndexes(
                    ImmutableList.of(
                            new IndexModel(Indexes.ascending("providerId", "remoteFileId"),
                                    new IndexOptions().unique(true)),
                            new IndexModel(Indexes.ascending("contentHash"))
                    )
            );
        }
    }

    @Override
    public List<CatalogItem> findByProvider(Long providerId) {
        return find(Filters.eq("providerId", providerId), null, 0, 0);
    }

    @Override
    public Optional<CatalogItem> findByProviderAndRemoteFileId(Long providerId, String remoteFileId) {
        return Optional.ofNullable(mongoCollection
                .find(Filters.and(Filters.eq("providerId", providerId), Filters.eq("remoteFileId", remoteFileId)))
                .first());
    }

    @Override
    public void updateContentHash(Long itemId, String contentHash) {
        mongoCollection.updateOne(Filters.eq("_id", itemId), Updates.set("contentHash", contentHash));
    }

    @Override
    protected Long generateId() {
        return idGenerator.generateId();
    }
}
