package org.janelia.mediasync.dao;

/**
 * Base interface for data access.
 *
 * @param <T> entity type
 * @param <I> entity identifier type
 */
public interface Dao<T, I> {
}
