package org.janelia.mediasync.dao;

/**
 * Read/Write data access interface.
 *
 * @param <T> entity type
 * @param <I> entity identifier type
 */
public interface ReadWriteDao<T, I> extends ReadOnlyDao<T, I> {
    /**
     * Inserts the entity if it has no identifier yet, otherwise replaces (or upserts) it by id.
     */
    void save(T entity);

    /**
     * @return true if an entity was deleted
     */
    boolean deleteById(I id);
}
