package org.janelia.mediasync.dataservice.storage;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.janelia.mediasync.dao.CatalogItemDao;
import org.janelia.mediasync.dataservice.cache.ContentCache;
import org.janelia.mediasync.model.CatalogItem;
import org.janelia.mediasync.model.MediaKind;
import org.janelia.mediasync.model.ProviderRecord;
import org.janelia.mediasync.model.StorageBackendKind;
import org.janelia.mediasync.utils.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only backend for a picker based remote photo service. Media items are imported by a separate
 * picker session, so the "listing" of this backend is the set of catalog items already imported for
 * the provider. Content is served from the imported local copy or from the content cache.
 */
public class RemotePickerStorageBackend implements StorageBackend, OAuthConnection {

    public static final String PICKER_SCOPE = "https://www.googleapis.com/auth/photospicker.mediaitems.readonly";

    private static final Logger LOG = LoggerFactory.getLogger(RemotePickerStorageBackend.class);

    private final CatalogItemDao catalogItemDao;
    private final ContentCache contentCache;
    private final ObjectMapper objectMapper;

    private Long providerId;
    private String displayName = "Remote Photos";
    private RemotePickerConfiguration configuration = new RemotePickerConfiguration();

    public RemotePickerStorageBackend(CatalogItemDao catalogItemDao, ContentCache contentCache, ObjectMapper objectMapper) {
        this.catalogItemDao = catalogItemDao;
        this.contentCache = contentCache;
        this.objectMapper = objectMapper;
    }

    @Override
    public Long getProviderId() {
        return providerId;
    }

    @Override
    public StorageBackendKind getKind() {
        return StorageBackendKind.REMOTE_PICKER;
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }

    public RemotePickerConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public void initialize(Long providerId, String displayName, String configurationBlob) {
        this.providerId = providerId;
        if (StringUtils.isNotBlank(displayName)) {
            this.displayName = displayName;
        }
        this.configuration = parseConfiguration(configurationBlob).orElseGet(RemotePickerConfiguration::new);
    }

    private Optional<RemotePickerConfiguration> parseConfiguration(String configurationBlob) {
        if (StringUtils.isBlank(configurationBlob)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(configurationBlob, RemotePickerConfiguration.class));
        } catch (JsonProcessingException e) {
            LOG.warn("Failed to parse remote picker configuration for provider {}, using defaults", providerId, e);
            return Optional.empty();
        }
    }

    @Override
    public Set<BackendCapability> getCapabilities() {
        return EnumSet.of(BackendCapability.OAUTH_DISCONNECT);
    }

    @Override
    public List<FileDescriptor> listFiles(String folderId, boolean recursive, CancellationSignal cancellation) {
        cancellation.throwIfCancelled();
        List<CatalogItem> importedItems = catalogItemDao.findByProvider(providerId);
        LOG.debug("Found {} items imported for remote picker provider {}", importedItems.size(), providerId);
        // items without a remote id cannot be matched against the catalog or read back
        return importedItems.stream()
                .filter(item -> StringUtils.isNotBlank(item.getRemoteFileId()))
                .sorted(Comparator.comparing(this::itemDate, Comparator.nullsLast(Comparator.<Date>reverseOrder())))
                .map(this::describeItem)
                .collect(Collectors.toList());
    }

    private Date itemDate(CatalogItem item) {
        return item.getDateTaken() != null ? item.getDateTaken() : item.getFirstSeenDate();
    }

    private FileDescriptor describeItem(CatalogItem item) {
        return FileDescriptor.builder(item.getRemoteFileId())
                .fileName(item.getFileName())
                .fullPath(item.getLocalPath())
                .size(item.getSize())
                .mediaKind(item.getMediaKind())
                .contentType(StringUtils.defaultIfBlank(item.getContentType(),
                        item.getMediaKind() == MediaKind.VIDEO ? "video/mp4" : "image/jpeg"))
                .createdDate(itemDate(item))
                .modifiedDate(item.getFirstSeenDate())
                .build();
    }

    @Override
    public UploadResult upload(String fileName, InputStream content, String contentType, CancellationSignal cancellation) {
        throw new ReadOnlyBackendException(displayName, "upload");
    }

    @Override
    public boolean delete(String remoteFileId, CancellationSignal cancellation) {
        throw new ReadOnlyBackendException(displayName, "delete");
    }

    @Override
    public InputStream openReadStream(String remoteFileId, CancellationSignal cancellation) throws IOException {
        cancellation.throwIfCancelled();
        CatalogItem item = findImportedItem(remoteFileId);
        if (StringUtils.isNotBlank(item.getLocalPath())) {
            Path localPath = Paths.get(item.getLocalPath());
            if (Files.isRegularFile(localPath)) {
                LOG.debug("Serving {} from local path {}", remoteFileId, localPath);
                return Files.newInputStream(localPath);
            }
        }
        if (StringUtils.isNotBlank(item.getContentHash())) {
            Optional<InputStream> cachedStream = contentCache.getCachedStream(item.getContentHash(), cancellation);
            if (cachedStream.isPresent()) {
                LOG.debug("Serving {} from the content cache", remoteFileId);
                return cachedStream.get();
            }
        }
        LOG.error("No content available for {} of provider {}", remoteFileId, providerId);
        throw new NoSuchFileException(remoteFileId, null, "Content not found, the item must be re-imported");
    }

    /**
     * Stores bytes fetched from the remote service in the content cache and records their hash on the
     * imported item so that later reads can be served without fetching them again.
     *
     * @return the content hash
     */
    public String storeFetchedContent(String remoteFileId, byte[] content, String contentType, CancellationSignal cancellation) throws IOException {
        CatalogItem item = findImportedItem(remoteFileId);
        String hash = contentCache.computeHash(new ByteArrayInputStream(content), cancellation);
        if (configuration.isEnableLocalCache()) {
            contentCache.cacheFile(hash,
                    new ByteArrayInputStream(content),
                    displayName + ":" + remoteFileId,
                    providerId,
                    remoteFileId,
                    StringUtils.defaultIfBlank(contentType, item.getContentType()),
                    cancellation);
        }
        cancellation.throwIfCancelled();
        catalogItemDao.updateContentHash(item.getId(), hash);
        item.setContentHash(hash);
        return hash;
    }

    private CatalogItem findImportedItem(String remoteFileId) throws NoSuchFileException {
        return catalogItemDao.findByProviderAndRemoteFileId(providerId, remoteFileId)
                .orElseThrow(() -> {
                    LOG.warn("Item {} not found for provider {}", remoteFileId, providerId);
                    return new NoSuchFileException(remoteFileId, null, "Item not found");
                });
    }

    @Override
    public boolean fileExists(String remoteFileId, CancellationSignal cancellation) {
        cancellation.throwIfCancelled();
        return catalogItemDao.findByProviderAndRemoteFileId(providerId, remoteFileId).isPresent();
    }

    /**
     * Validates that client credentials, a refresh token and, when scopes were recorded, the picker
     * scope are present. Token acquisition and refresh happen elsewhere.
     */
    @Override
    public boolean testConnection(CancellationSignal cancellation) {
        cancellation.throwIfCancelled();
        if (StringUtils.isAnyBlank(configuration.getClientId(), configuration.getClientSecret())) {
            LOG.debug("Connection test for provider {} failed: missing client credentials", providerId);
            return false;
        }
        if (StringUtils.isBlank(configuration.getRefreshToken())) {
            LOG.debug("Connection test for provider {} failed: missing refresh token", providerId);
            return false;
        }
        if (CollectionUtils.isNotEmpty(configuration.getGrantedScopes()) && !hasRequiredScopes(configuration.getGrantedScopes())) {
            LOG.warn("Connection test for provider {} failed: picker scope not granted, granted scopes: {}",
                    providerId, configuration.getGrantedScopes());
            return false;
        }
        return true;
    }

    public static boolean hasRequiredScopes(List<String> grantedScopes) {
        return grantedScopes.stream().anyMatch(scope -> StringUtils.equalsIgnoreCase(scope, PICKER_SCOPE));
    }

    @Override
    public boolean disconnect(ProviderRecord providerRecord) {
        boolean cleaned = true;
        if (StringUtils.isNotBlank(providerRecord.getConfiguration())) {
            try {
                RemotePickerConfiguration recordConfiguration = objectMapper.readValue(providerRecord.getConfiguration(), RemotePickerConfiguration.class);
                recordConfiguration.setRefreshToken(null);
                recordConfiguration.setAccessToken(null);
                recordConfiguration.setAccessTokenExpiry(null);
                recordConfiguration.setGrantedScopes(null);
                providerRecord.setConfiguration(objectMapper.writeValueAsString(recordConfiguration));
            } catch (JsonProcessingException e) {
                LOG.error("Failed to clear the credentials of provider {}", providerRecord.getId(), e);
                cleaned = false;
            }
        }
        providerRecord.setEnabled(false);
        LOG.info("Disconnected provider {}", providerRecord.getId());
        return cleaned;
    }
}
