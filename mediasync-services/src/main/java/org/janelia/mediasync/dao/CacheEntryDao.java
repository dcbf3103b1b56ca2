package org.janelia.mediasync.dao;

import java.util.Date;
import java.util.List;
import java.util.Optional;

import org.janelia.mediasync.model.CacheEntry;
import org.janelia.mediasync.model.page.PageRequest;
import org.janelia.mediasync.model.page.PageResult;

/**
 * Bookkeeping index of the content cache, keyed by content hash.
 */
public interface CacheEntryDao extends ReadWriteDao<CacheEntry, String> {
    /**
     * Inserts the entry unless one with the same hash already exists.
     *
     * @return true if the entry was inserted, false if the hash was already indexed
     */
    boolean insertIfAbsent(CacheEntry entry);

    Optional<CacheEntry> findByProviderFileId(Long providerId, String providerFileId);

    List<CacheEntry> findByProvider(Long providerId);

    /**
     * @return all entries, least recently accessed first
     */
    List<CacheEntry> findAllOrderedByLastAccess();

    /**
     * @return a page of entries, most recently accessed first
     */
    PageResult<CacheEntry> findMostRecentlyAccessed(PageRequest pageRequest);

    /**
     * Records an access: sets the last access date and increments the access count.
     *
     * @return the updated entry or empty if the hash is not indexed
     */
    Optional<CacheEntry> touch(String hash, Date accessDate);

    long totalSize();

    void deleteAll();
}
