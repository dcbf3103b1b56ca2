package org.janelia.mediasync.dao.mongo;

import java.util.Date;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.google.common.collect.ImmutableList;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Accumulators;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexModel;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import org.bson.Document;
import org.janelia.mediasync.cdi.qualifier.BoolPropertyValue;
import org.janelia.mediasync.dao.CacheEntryDao;
import org.janelia.mediasync.model.CacheEntry;
import org.janelia.mediasync.model.page.PageRequest;
import org.janelia.mediasync.model.page.PageResult;

/**
 * Mongo based implementation of CacheEntryDao. The content hash is stored as the document id so
 * the database itself rejects a second row for the same content.
 */
@ApplicationScoped
public class CacheEntryMongoDao extends AbstractMongoDao<CacheEntry, String> implements CacheEntryDao {

    @Inject
    public CacheEntryMongoDao(MongoDatabase mongoDatabase,
                              @BoolPropertyValue(name = "MongoDB.createCollectionIndexes", defaultValue = true) boolean createCollectionIndexes) {
        super(mongoDatabase, "contentCacheEntry", CacheEntry.class);
        if (createCollectionIndexes) {
            mongoCollection.createIndexes(
                    ImmutableList.of(
                            new IndexModel(Indexes.ascending("lastAccessedDate")),
                            new IndexModel(Indexes.ascending("providerId", "providerFileId"))
                    )
            );
        }
    }

    @Override
    public boolean insertIfAbsent(CacheEntry entry) {
        try {
            mongoCollection.insertOne(entry);
            return true;
        } catch (MongoWriteException e) {
            if (e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public Optional<CacheEntry> findByProviderFileId(Long providerId, String providerFileId) {
        return Optional.ofNullable(mongoCollection
                .find(Filters.and(Filters.eq("providerId", providerId), Filters.eq("providerFileId", providerFileId)))
                .first());
    }

    @Override
    public List<CacheEntry> findByProvider(Long providerId) {
        return find(Filters.eq("providerId", providerId), null, 0, 0);
    }

    @Override
    public List<CacheEntry> findAllOrderedByLastAccess() {
        return find(null, Sorts.ascending("lastAccessedDate", "_id"), 0, 0);
    }

    @Override
    public PageResult<CacheEntry> findMostRecentlyAccessed(PageRequest pageRequest) {
        List<CacheEntry> entries = find(null,
                Sorts.descending("lastAccessedDate"),
                pageRequest.getOffset(),
                pageRequest.getPageSize());
        return new PageResult<>(pageRequest, entries, countAll());
    }

    @Override
    public Optional<CacheEntry> touch(String hash, Date accessDate) {
        return Optional.ofNullable(mongoCollection.findOneAndUpdate(
                Filters.eq("_id", hash),
                Updates.combine(
                        Updates.set("lastAccessedDate", accessDate.getTime()),
                        Updates.inc("accessCount", 1)),
                new FindOneAndUpdateOptions().returnDocument(ReturnDocument.AFTER)));
    }

    @Override
    public long totalSize() {
        Document sizeSum = mongoCollection
                .aggregate(ImmutableList.of(Aggregates.group(null, Accumulators.sum("total", "$size"))), Document.class)
                .first();
        if (sizeSum == null) {
            return 0L;
        }
        Number total = sizeSum.get("total", Number.class);
        return total == null ? 0L : total.longValue();
    }

    @Override
    public void deleteAll() {
        mongoCollection.deleteMany(new Document());
    }

    @Override
    protected String generateId() {
        throw new IllegalArgumentException("Cache entries must be saved with their content hash as id");
    }
}
