package org.janelia.mediasync.dao.mongo;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.ReplaceOptions;
import org.bson.conversions.Bson;
import org.janelia.mediasync.dao.ReadWriteDao;
import org.janelia.mediasync.model.HasIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.mongodb.client.model.Filters.eq;

/**
 * Abstract Mongo DAO.
 *
 * @param <T> type of the element
 * @param <I> type of the element identifier
 */
public abstract class AbstractMongoDao<T extends HasIdentifier<I>, I> implements ReadWriteDao<T, I> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractMongoDao.class);

    protected final MongoCollection<T> mongoCollection;
    private final Class<T> entityType;

    protected AbstractMongoDao(MongoDatabase mongoDatabase, String collectionName, Class<T> entityType) {
        Preconditions.checkArgument(mongoDatabase != null, "Mongo database is required for " + entityType.getName());
        this.mongoCollection = mongoDatabase.getCollection(collectionName, entityType);
        this.entityType = entityType;
    }

    protected Class<T> getEntityType() {
        return entityType;
    }

    @Override
    public T findById(I id) {
        if (id == null) {
            return null;
        }
        return mongoCollection.find(eq("_id", id)).first();
    }

    @Override
    public List<T> findAll() {
        return find(null, null, 0, 0);
    }

    protected List<T> find(Bson queryFilter, Bson sortCriteria, long offset, int length) {
        List<T> entityDocs = new ArrayList<>();
        FindIterable<T> results = mongoCollection.find(entityType);
        if (queryFilter != null) {
            results = results.filter(queryFilter);
        }
        if (offset > 0) {
            results = results.skip((int) offset);
        }
        if (length > 0) {
            results = results.limit(length);
        }
        return results
                .sort(sortCriteria)
                .into(entityDocs);
    }

    protected long count(Bson queryFilter) {
        if (queryFilter == null) {
            return mongoCollection.countDocuments();
        } else {
            return mongoCollection.countDocuments(queryFilter);
        }
    }

    @Override
    public long countAll() {
        return count(null);
    }

    @Override
    public void save(T entity) {
        if (entity.getId() == null) {
            entity.setId(generateId());
            LOG.trace("Insert {}", entity);
            mongoCollection.insertOne(entity);
        } else {
            LOG.trace("Replace {}", entity);
            mongoCollection.replaceOne(eq("_id", entity.getId()), entity, new ReplaceOptions().upsert(true));
        }
    }

    @Override
    public boolean deleteById(I id) {
        return mongoCollection.deleteOne(eq("_id", id)).getDeletedCount() > 0;
    }

    /**
     * @return a new identifier for an entity that is saved without one
     */
    protected abstract I generateId();
}
