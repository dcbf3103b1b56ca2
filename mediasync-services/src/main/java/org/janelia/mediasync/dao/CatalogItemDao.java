package org.janelia.mediasync.dao;

import java.util.List;
import java.util.Optional;

import org.janelia.mediasync.model.CatalogItem;

/**
 * Catalog persistence. Items are unique by (providerId, remoteFileId).
 */
public interface CatalogItemDao extends ReadWriteDao<CatalogItem, Long> {
    List<CatalogItem> findByProvider(Long providerId);
    Optional<CatalogItem> findByProviderAndRemoteFileId(Long providerId, String remoteFileId);
    void updateContentHash(Long itemId, String contentHash);
}
