package org.janelia.mediasync.dao;

import java.util.List;

/**
 * Read only data access interface.
 *
 * @param <T> entity type
 * @param <I> entity identifier type
 */
public interface ReadOnlyDao<T, I> extends Dao<T, I> {
    T findById(I id);
    List<T> findAll();
    long countAll();
}
