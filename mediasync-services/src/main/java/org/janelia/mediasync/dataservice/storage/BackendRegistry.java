package org.janelia.mediasync.dataservice.storage;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.NotImplementedException;
import org.janelia.mediasync.cdi.qualifier.StrPropertyValue;
import org.janelia.mediasync.dao.CatalogItemDao;
import org.janelia.mediasync.dao.ProviderRecordDao;
import org.janelia.mediasync.dataservice.cache.ContentCache;
import org.janelia.mediasync.model.ProviderRecord;
import org.janelia.mediasync.model.StorageBackendKind;
import org.janelia.mediasync.utils.CancellationSignal;
import org.slf4j.Logger;

/**
 * Creates, initializes and caches one {@link StorageBackend} per provider. While an instance is cached every
 * lookup for its provider returns that same instance. Any change to a provider record must be followed by
 * {@link #invalidate(Long)} or {@link #clearCache()}, otherwise the backend keeps using the old configuration.
 *
 * Each cached instance is stamped with the cache generation it was created in; {@link #clearCache()} moves
 * to a new generation so that an instance created concurrently from a stale record is never handed out.
 */
@ApplicationScoped
public class BackendRegistry {

    static final String DEFAULT_LOCAL_BACKEND_NAME = "Local Storage";

    private static class CachedBackend {
        private final StorageBackend backend;
        private final long generation;

        CachedBackend(StorageBackend backend, long generation) {
            this.backend = backend;
            this.generation = generation;
        }
    }

    private final ProviderRecordDao providerRecordDao;
    private final CatalogItemDao catalogItemDao;
    private final ContentCache contentCache;
    private final MediaFileScanner mediaFileScanner;
    private final ObjectMapper objectMapper;
    private final String defaultLocalPath;
    private final Logger logger;
    private final ConcurrentMap<Long, CachedBackend> backendCache = new ConcurrentHashMap<>();
    private final AtomicLong cacheGeneration = new AtomicLong();

    @Inject
    public BackendRegistry(ProviderRecordDao providerRecordDao,
                           CatalogItemDao catalogItemDao,
                           ContentCache contentCache,
                           MediaFileScanner mediaFileScanner,
                           ObjectMapper objectMapper,
                           @StrPropertyValue(name = "Storage.LocalPath", defaultValue = "media") String defaultLocalPath,
                           Logger logger) {
        this.providerRecordDao = providerRecordDao;
        this.catalogItemDao = catalogItemDao;
        this.contentCache = contentCache;
        this.mediaFileScanner = mediaFileScanner;
        this.objectMapper = objectMapper;
        this.defaultLocalPath = defaultLocalPath;
        this.logger = logger;
    }

    /**
     * @return the initialized backend or empty if the provider does not exist or is disabled
     */
    public Optional<StorageBackend> getBackend(Long providerId, CancellationSignal cancellation) {
        cancellation.throwIfCancelled();
        if (providerId == null) {
            return Optional.empty();
        }
        CachedBackend cachedBackend = backendCache.get(providerId);
        if (cachedBackend != null && cachedBackend.generation == cacheGeneration.get()) {
            return Optional.of(cachedBackend.backend);
        }
        ProviderRecord providerRecord = providerRecordDao.findById(providerId);
        if (providerRecord == null || !providerRecord.isEnabled()) {
            logger.debug("Provider {} not found or disabled", providerId);
            return Optional.empty();
        }
        return Optional.of(resolveBackend(providerRecord));
    }

    public List<StorageBackend> getAllBackends(CancellationSignal cancellation) {
        cancellation.throwIfCancelled();
        return resolveBackends(providerRecordDao.findEnabled());
    }

    public List<StorageBackend> getBackendsByKind(StorageBackendKind kind, CancellationSignal cancellation) {
        cancellation.throwIfCancelled();
        return resolveBackends(providerRecordDao.findEnabledByKind(kind));
    }

    private List<StorageBackend> resolveBackends(List<ProviderRecord> providerRecords) {
        return providerRecords.stream()
                .filter(ProviderRecord::isEnabled)
                .map(providerRecord -> {
                    try {
                        return Optional.of(resolveBackend(providerRecord));
                    } catch (NotImplementedException | IllegalArgumentException e) {
                        logger.warn("Skip provider {}: {}", providerRecord.getId(), e.getMessage());
                        return Optional.<StorageBackend>empty();
                    }
                })
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect(Collectors.toList());
    }

    private StorageBackend resolveBackend(ProviderRecord providerRecord) {
        long generation = cacheGeneration.get();
        CachedBackend cachedBackend = backendCache.compute(providerRecord.getId(), (providerId, current) -> {
            if (current != null && current.generation == generation) {
                return current;
            }
            StorageBackend backend = createBackend(providerRecord.getKind());
            backend.initialize(providerRecord.getId(), providerRecord.getName(), providerRecord.getConfiguration());
            logger.info("Initialized {} backend for provider {} ({})", providerRecord.getKind(), providerId, providerRecord.getName());
            return new CachedBackend(backend, generation);
        });
        return cachedBackend.backend;
    }

    /**
     * Drops the cached instance of one provider.
     */
    public void invalidate(Long providerId) {
        if (backendCache.remove(providerId) != null) {
            logger.debug("Invalidated the backend of provider {}", providerId);
        }
    }

    /**
     * Drops all cached instances; subsequent lookups create new instances from the persisted configuration.
     */
    public void clearCache() {
        cacheGeneration.incrementAndGet();
        backendCache.clear();
        logger.info("Cleared the storage backend cache");
    }

    /**
     * Creates an uninitialized backend of the given kind without looking at any provider record.
     *
     * @throws NotImplementedException for declared kinds that have no implementation
     * @throws IllegalArgumentException if the kind is missing
     */
    public StorageBackend createBackend(StorageBackendKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("Storage backend kind is required");
        }
        switch (kind) {
            case LOCAL:
                return new LocalStorageBackend(mediaFileScanner, objectMapper, defaultLocalPath);
            case REMOTE_PICKER:
                return new RemotePickerStorageBackend(catalogItemDao, contentCache, objectMapper);
            case GOOGLE_DRIVE:
            case ONE_DRIVE:
                throw new NotImplementedException(kind + " storage backend is not implemented");
            default:
                throw new IllegalArgumentException("Unknown storage backend kind: " + kind);
        }
    }

    public StorageBackend createBackend(int kindCode) {
        return createBackend(StorageBackendKind.fromCode(kindCode));
    }

    /**
     * Returns the backend of the first enabled local provider, creating and persisting a provider that points
     * to the configured default path if there is none.
     */
    public StorageBackend getOrCreateDefaultLocalBackend(CancellationSignal cancellation) {
        cancellation.throwIfCancelled();
        List<ProviderRecord> localProviders = providerRecordDao.findEnabledByKind(StorageBackendKind.LOCAL);
        if (!localProviders.isEmpty()) {
            return resolveBackend(localProviders.get(0));
        }
        ProviderRecord providerRecord = new ProviderRecord();
        providerRecord.setKind(StorageBackendKind.LOCAL);
        providerRecord.setName(DEFAULT_LOCAL_BACKEND_NAME);
        providerRecord.setEnabled(true);
        LocalStorageConfiguration localStorageConfiguration = new LocalStorageConfiguration(defaultLocalPath);
        localStorageConfiguration.setOrganizeByDate(true);
        localStorageConfiguration.setWatchForChanges(true);
        try {
            providerRecord.setConfiguration(objectMapper.writeValueAsString(localStorageConfiguration));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
        cancellation.throwIfCancelled();
        providerRecordDao.save(providerRecord);
        logger.info("Created default local storage provider {} at {}", providerRecord.getId(), defaultLocalPath);
        return resolveBackend(providerRecord);
    }
}
