package org.janelia.mediasync.asyncservice.sync;

import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.google.common.collect.Lists;
import org.apache.commons.lang3.StringUtils;
import org.janelia.mediasync.cdi.qualifier.IntPropertyValue;
import org.janelia.mediasync.cdi.qualifier.MediaSyncDefault;
import org.janelia.mediasync.dao.CatalogItemDao;
import org.janelia.mediasync.dao.ProviderRecordDao;
import org.janelia.mediasync.dataservice.storage.BackendRegistry;
import org.janelia.mediasync.dataservice.storage.FileDescriptor;
import org.janelia.mediasync.dataservice.storage.StorageBackend;
import org.janelia.mediasync.model.CatalogItem;
import org.janelia.mediasync.utils.CancellationSignal;
import org.slf4j.Logger;

/**
 * Reconciles the catalog of a provider with the current listing of its storage backend.
 *
 * A provider is synced by at most one run at a time. The run is registered atomically in the calling
 * thread before any work is scheduled and is always released when the run ends, whether it completes,
 * fails or gets cancelled. None of the returned futures completes exceptionally; failures are reported
 * in the results.
 */
@ApplicationScoped
public class SyncEngine {

    private static final int PROGRESS_UPDATE_INTERVAL = 10;

    private final BackendRegistry backendRegistry;
    private final ProviderRecordDao providerRecordDao;
    private final CatalogItemDao catalogItemDao;
    private final SyncRunRegistry syncRunRegistry;
    private final ExecutorService executorService;
    private final int maxConcurrentProviders;
    private final int scanSampleSize;
    private final Logger logger;

    @Inject
    public SyncEngine(BackendRegistry backendRegistry,
                      ProviderRecordDao providerRecordDao,
                      CatalogItemDao catalogItemDao,
                      SyncRunRegistry syncRunRegistry,
                      @MediaSyncDefault ExecutorService executorService,
                      @IntPropertyValue(name = "Sync.MaxConcurrentProviders", defaultValue = 1) int maxConcurrentProviders,
                      @IntPropertyValue(name = "Sync.ScanSampleSize", defaultValue = 10) int scanSampleSize,
                      Logger logger) {
        this.backendRegistry = backendRegistry;
        this.providerRecordDao = providerRecordDao;
        this.catalogItemDao = catalogItemDao;
        this.syncRunRegistry = syncRunRegistry;
        this.executorService = executorService;
        this.maxConcurrentProviders = Math.max(1, maxConcurrentProviders);
        this.scanSampleSize = Math.max(0, scanSampleSize);
        this.logger = logger;
    }

    public CompletableFuture<SyncResult> syncProvider(Long providerId, SyncRequest syncRequest, CancellationSignal cancellation) {
        Date requestTime = new Date();
        if (providerId == null) {
            return CompletableFuture.completedFuture(SyncResult.failed(null, "", SyncResult.PROVIDER_NOT_FOUND, requestTime));
        }
        Optional<SyncRun> registeredRun = syncRunRegistry.tryRegister(providerId,
                cancellation != null ? cancellation : CancellationSignal.none());
        if (!registeredRun.isPresent()) {
            logger.info("Sync for provider {} is already in progress", providerId);
            return CompletableFuture.completedFuture(SyncResult.failed(providerId, "", SyncResult.ALREADY_IN_PROGRESS, requestTime));
        }
        SyncRun syncRun = registeredRun.get();
        SyncRequest request = syncRequest != null ? syncRequest : new SyncRequest();
        // the run executes even if the caller completes or cancels the future first
        CompletableFuture<SyncResult> syncResult = new CompletableFuture<>();
        try {
            executorService.execute(() -> syncResult.complete(runSync(syncRun, request)));
        } catch (RejectedExecutionException e) {
            syncRun.close();
            logger.error("Could not schedule sync for provider {}", providerId, e);
            return CompletableFuture.completedFuture(SyncResult.failed(providerId, "", "Sync could not be scheduled: " + e.getMessage(), requestTime));
        }
        syncResult.whenComplete((result, error) -> {
            if (syncResult.isCancelled()) {
                logger.info("Caller cancelled the sync of provider {}", providerId);
                syncRun.cancel();
            }
        });
        return syncResult;
    }

    private SyncResult runSync(SyncRun syncRun, SyncRequest request) {
        try (SyncRun run = syncRun) {
            SyncResult syncResult = executeSync(run, request);
            syncRunRegistry.recordResult(syncResult);
            return syncResult;
        }
    }

    private SyncResult executeSync(SyncRun run, SyncRequest request) {
        Long providerId = run.getProviderId();
        String providerName = "";
        try {
            Optional<StorageBackend> backend = backendRegistry.getBackend(providerId, run.getCancellation());
            if (!backend.isPresent()) {
                logger.warn("Cannot sync provider {}: not found or disabled", providerId);
                return SyncResult.failed(providerId, providerName, SyncResult.PROVIDER_NOT_FOUND, run.getStartTime());
            }
            providerName = backend.get().getDisplayName();
            logger.info("Start sync for provider {} ({}) with {}", providerId, providerName, request);
            return reconcile(run, backend.get(), request);
        } catch (CancellationException e) {
            logger.info("Sync for provider {} was cancelled", providerId);
            return SyncResult.cancelled(providerId, providerName, run.getStartTime());
        } catch (Exception e) {
            logger.error("Error syncing provider {}", providerId, e);
            return SyncResult.failed(providerId, providerName, StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getName()), run.getStartTime());
        }
    }

    private SyncResult reconcile(SyncRun run, StorageBackend backend, SyncRequest request) throws Exception {
        Long providerId = run.getProviderId();
        CancellationSignal cancellation = run.getCancellation();

        run.updateProgress(0, "Scanning files...", 0, 0);
        List<FileDescriptor> remoteFiles = syncableFiles(providerId,
                backend.listFiles(request.getFolderId(), request.isRecursive(), cancellation));
        cancellation.throwIfCancelled();
        int totalFiles = remoteFiles.size();
        run.updateProgress(10, String.format("Found %d files, processing...", totalFiles), 0, totalFiles);

        Map<String, CatalogItem> existingItems = indexByRemoteFileId(catalogItemDao.findByProvider(providerId));
        boolean compareExisting = request.isFullSync() || !request.isSkipExisting();
        Set<String> listedFileIds = new HashSet<>();
        List<String> errors = new ArrayList<>();
        int added = 0;
        int updated = 0;
        int skipped = 0;
        int removed = 0;
        int processed = 0;

        for (FileDescriptor remoteFile : remoteFiles) {
            cancellation.throwIfCancelled();
            boolean firstOccurrence = listedFileIds.add(remoteFile.getRemoteFileId());
            CatalogItem existingItem = existingItems.get(remoteFile.getRemoteFileId());
            try {
                if (existingItem == null) {
                    if (!firstOccurrence) {
                        skipped++;
                    } else if (request.getMaxFiles() <= 0 || added < request.getMaxFiles()) {
                        catalogItemDao.save(newCatalogItem(providerId, remoteFile));
                        added++;
                    } else {
                        logger.debug("Skip adding {} - the limit of {} new files was reached", remoteFile.getRemoteFileId(), request.getMaxFiles());
                    }
                } else if (compareExisting && hasChanged(existingItem, remoteFile)) {
                    applyChanges(existingItem, remoteFile);
                    catalogItemDao.save(existingItem);
                    updated++;
                } else {
                    skipped++;
                }
            } catch (CancellationException e) {
                throw e;
            } catch (Exception e) {
                logger.warn("Error processing {} while syncing provider {}", remoteFile.getRemoteFileId(), providerId, e);
                errors.add("Error processing " + StringUtils.defaultIfBlank(remoteFile.getFileName(), remoteFile.getRemoteFileId()) + ": " + e.getMessage());
            }
            processed++;
            if (processed % PROGRESS_UPDATE_INTERVAL == 0 || processed == totalFiles) {
                run.updateProgress(10 + (int) (80.0 * processed / totalFiles),
                        String.format("Processing files (%d/%d)...", processed, totalFiles),
                        processed, totalFiles);
            }
        }

        if (request.isRemoveDeleted()) {
            run.updateProgress(95, "Checking for deleted files...", processed, totalFiles);
            for (CatalogItem existingItem : existingItems.values()) {
                if (listedFileIds.contains(existingItem.getRemoteFileId())) {
                    continue;
                }
                cancellation.throwIfCancelled();
                try {
                    if (catalogItemDao.deleteById(existingItem.getId())) {
                        logger.debug("Removed {} of provider {} from the catalog", existingItem.getRemoteFileId(), providerId);
                        removed++;
                    }
                } catch (Exception e) {
                    logger.warn("Error removing {} while syncing provider {}", existingItem.getRemoteFileId(), providerId, e);
                    errors.add("Error removing " + StringUtils.defaultIfBlank(existingItem.getFileName(), existingItem.getRemoteFileId()) + ": " + e.getMessage());
                }
            }
        }

        cancellation.throwIfCancelled();
        providerRecordDao.updateLastSyncDate(providerId, new Date());
        run.updateProgress(100, "Completed", processed, totalFiles);
        logger.info("Completed sync for provider {}: {} added, {} updated, {} removed, {} skipped, {} errors",
                providerId, added, updated, removed, skipped, errors.size());
        return SyncResult.successful(providerId, backend.getDisplayName(), added, updated, removed, skipped, totalFiles,
                run.getStartTime(), errors);
    }

    private List<FileDescriptor> syncableFiles(Long providerId, List<FileDescriptor> listedFiles) {
        return listedFiles.stream()
                .filter(f -> !f.isFolder())
                .filter(f -> {
                    if (StringUtils.isBlank(f.getRemoteFileId())) {
                        logger.warn("Ignore {} listed by provider {} because it has no remote file id", f.getFileName(), providerId);
                        return false;
                    }
                    return true;
                })
                .collect(Collectors.toList());
    }

    private Map<String, CatalogItem> indexByRemoteFileId(List<CatalogItem> catalogItems) {
        Map<String, CatalogItem> itemsByRemoteFileId = new HashMap<>();
        for (CatalogItem catalogItem : catalogItems) {
            if (catalogItem.getRemoteFileId() != null) {
                itemsByRemoteFileId.putIfAbsent(catalogItem.getRemoteFileId(), catalogItem);
            }
        }
        return itemsByRemoteFileId;
    }

    private CatalogItem newCatalogItem(Long providerId, FileDescriptor remoteFile) {
        Date now = new Date();
        CatalogItem catalogItem = new CatalogItem();
        catalogItem.setProviderId(providerId);
        catalogItem.setRemoteFileId(remoteFile.getRemoteFileId());
        catalogItem.setFileName(remoteFile.getFileName());
        catalogItem.setLocalPath(StringUtils.defaultIfBlank(remoteFile.getFullPath(), remoteFile.getRemoteFileId()));
        catalogItem.setSize(remoteFile.getSize());
        catalogItem.setMediaKind(remoteFile.getMediaKind());
        catalogItem.setContentType(remoteFile.getContentType());
        catalogItem.setDateTaken(remoteFile.getCreatedDate());
        catalogItem.setFirstSeenDate(now);
        catalogItem.setLastSeenDate(now);
        return catalogItem;
    }

    private boolean hasChanged(CatalogItem catalogItem, FileDescriptor remoteFile) {
        return catalogItem.getSize() != remoteFile.getSize();
    }

    private void applyChanges(CatalogItem catalogItem, FileDescriptor remoteFile) {
        catalogItem.setSize(remoteFile.getSize());
        if (StringUtils.isNotBlank(remoteFile.getFileName())) {
            catalogItem.setFileName(remoteFile.getFileName());
        }
        if (StringUtils.isNotBlank(remoteFile.getContentType())) {
            catalogItem.setContentType(remoteFile.getContentType());
        }
        catalogItem.setLastSeenDate(new Date());
    }

    /**
     * @return a snapshot of the running sync or, if there is none, the idle state with the last result
     */
    public SyncStatus getSyncStatus(Long providerId) {
        return syncRunRegistry.getActiveRun(providerId)
                .map(SyncRun::getStatus)
                .orElseGet(() -> SyncStatus.idle(providerId, syncRunRegistry.getLastResult(providerId).orElse(null)));
    }

    /**
     * Signals the running sync of the provider to stop. It does not wait for the run to end.
     *
     * @return true if a running sync was found
     */
    public boolean cancelSync(Long providerId) {
        boolean found = providerId != null && syncRunRegistry.cancel(providerId);
        if (found) {
            logger.info("Requested cancellation of the sync for provider {}", providerId);
        }
        return found;
    }

    /**
     * Reports what a sync of the provider would add without changing the catalog. Scans do not take the
     * single sync guard, so they may run concurrently with each other and with a sync.
     */
    public CompletableFuture<ScanResult> scanProvider(Long providerId, CancellationSignal cancellation) {
        CancellationSignal scanCancellation = cancellation != null ? cancellation : CancellationSignal.none();
        try {
            return CompletableFuture.supplyAsync(() -> executeScan(providerId, scanCancellation), executorService);
        } catch (RejectedExecutionException e) {
            logger.error("Could not schedule scan for provider {}", providerId, e);
            return CompletableFuture.completedFuture(ScanResult.failed(providerId, "Scan could not be scheduled: " + e.getMessage()));
        }
    }

    private ScanResult executeScan(Long providerId, CancellationSignal cancellation) {
        try {
            Optional<StorageBackend> backend = backendRegistry.getBackend(providerId, cancellation);
            if (!backend.isPresent()) {
                return ScanResult.failed(providerId, SyncResult.PROVIDER_NOT_FOUND);
            }
            List<FileDescriptor> remoteFiles = syncableFiles(providerId, backend.get().listFiles(null, true, cancellation));
            cancellation.throwIfCancelled();
            Set<String> existingFileIds = catalogItemDao.findByProvider(providerId).stream()
                    .map(CatalogItem::getRemoteFileId)
                    .collect(Collectors.toSet());
            List<FileDescriptor> newFiles = remoteFiles.stream()
                    .filter(f -> !existingFileIds.contains(f.getRemoteFileId()))
                    .collect(Collectors.toList());
            long newFilesTotalSize = newFiles.stream().mapToLong(FileDescriptor::getSize).sum();
            logger.info("Scanned provider {}: found {} files, {} new", providerId, remoteFiles.size(), newFiles.size());
            return ScanResult.scanned(providerId, remoteFiles.size(), newFiles.size(), newFilesTotalSize,
                    newFiles.subList(0, Math.min(scanSampleSize, newFiles.size())));
        } catch (CancellationException e) {
            return ScanResult.failed(providerId, "Scan was cancelled");
        } catch (Exception e) {
            logger.error("Error scanning provider {}", providerId, e);
            return ScanResult.failed(providerId, StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getName()));
        }
    }

    /**
     * Syncs every enabled provider, {@code Sync.MaxConcurrentProviders} at a time. A failing provider does not
     * stop the others.
     *
     * @return one result per provider
     */
    public CompletableFuture<List<SyncResult>> syncAllProviders(SyncRequest syncRequest, CancellationSignal cancellationSignal) {
        CancellationSignal cancellation = cancellationSignal != null ? cancellationSignal : CancellationSignal.none();
        List<Long> providerIds;
        try {
            providerIds = backendRegistry.getAllBackends(cancellation).stream()
                    .map(StorageBackend::getProviderId)
                    .collect(Collectors.toList());
        } catch (CancellationException e) {
            logger.info("Sync of all providers was cancelled");
            return CompletableFuture.completedFuture(new ArrayList<>());
        } catch (Exception e) {
            logger.error("Error retrieving the storage providers to sync", e);
            return CompletableFuture.completedFuture(new ArrayList<>());
        }
        logger.info("Sync {} providers, {} at a time", providerIds.size(), maxConcurrentProviders);
        CompletableFuture<List<SyncResult>> allResults = CompletableFuture.completedFuture(new ArrayList<>());
        for (List<Long> batch : Lists.partition(providerIds, maxConcurrentProviders)) {
            allResults = allResults.thenCompose(results -> {
                List<CompletableFuture<SyncResult>> batchResults = batch.stream()
                        .map(providerId -> syncProvider(providerId, syncRequest, cancellation)
                                .exceptionally(e -> SyncResult.failed(providerId, "", e.getMessage(), new Date())))
                        .collect(Collectors.toList());
                return CompletableFuture.allOf(batchResults.toArray(new CompletableFuture<?>[0]))
                        .thenApply(ignored -> {
                            batchResults.forEach(f -> results.add(f.join()));
                            return results;
                        });
            });
        }
        return allResults;
    }
}
