package org.janelia.mediasync.asyncservice.sync;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;
import org.janelia.mediasync.dao.InMemoryCatalogItemDao;
import org.janelia.mediasync.dao.InMemoryProviderRecordDao;
import org.janelia.mediasync.dataservice.storage.BackendRegistry;
import org.janelia.mediasync.dataservice.storage.FileDescriptor;
import org.janelia.mediasync.dataservice.storage.StorageBackend;
import org.janelia.mediasync.model.CatalogItem;
import org.janelia.mediasync.model.MediaKind;
import org.janelia.mediasync.model.ProviderRecord;
import org.janelia.mediasync.model.StorageBackendKind;
import org.janelia.mediasync.utils.CancellationSignal;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;
import org.slf4j.Logger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;

public class SyncEngineTest {

    private static final long TIMEOUT_SECONDS = 10;

    private BackendRegistry backendRegistry;
    private InMemoryProviderRecordDao providerRecordDao;
    private InMemoryCatalogItemDao catalogItemDao;
    private SyncRunRegistry syncRunRegistry;
    private ExecutorService executorService;
    private SyncEngine syncEngine;

    @Before
    public void setUp() {
        backendRegistry = mock(BackendRegistry.class);
        providerRecordDao = new InMemoryProviderRecordDao();
        catalogItemDao = new InMemoryCatalogItemDao();
        syncRunRegistry = new SyncRunRegistry();
        executorService = Executors.newFixedThreadPool(4);
        syncEngine = createSyncEngine(1);
        Mockito.when(backendRegistry.getBackend(any(), any())).thenReturn(Optional.empty());
    }

    @After
    public void tearDown() {
        executorService.shutdownNow();
    }

    private SyncEngine createSyncEngine(int maxConcurrentProviders) {
        return new SyncEngine(backendRegistry, providerRecordDao, catalogItemDao, syncRunRegistry, executorService,
                maxConcurrentProviders, 2, mock(Logger.class));
    }

    private ProviderRecord createProvider(String name) {
        ProviderRecord providerRecord = new ProviderRecord();
        providerRecord.setKind(StorageBackendKind.LOCAL);
        providerRecord.setName(name);
        providerRecordDao.save(providerRecord);
        return providerRecord;
    }

    private StorageBackend registerBackend(ProviderRecord providerRecord, List<FileDescriptor> files) throws IOException {
        StorageBackend backend = mock(StorageBackend.class);
        Mockito.when(backend.getProviderId()).thenReturn(providerRecord.getId());
        Mockito.when(backend.getDisplayName()).thenReturn(providerRecord.getName());
        Mockito.when(backend.listFiles(any(), anyBoolean(), any())).thenReturn(files);
        Mockito.when(backendRegistry.getBackend(eq(providerRecord.getId()), any())).thenReturn(Optional.of(backend));
        return backend;
    }

    private static FileDescriptor file(String fileId, long size) {
        return FileDescriptor.builder(fileId)
                .fileName(fileId.substring(fileId.lastIndexOf('/') + 1))
                .fullPath("/media/" + fileId)
                .size(size)
                .mediaKind(MediaKind.PHOTO)
                .contentType("image/jpeg")
                .createdDate(new Date(1000L))
                .build();
    }

    private static List<FileDescriptor> files(FileDescriptor... fileDescriptors) {
        return new ArrayList<>(Arrays.asList(fileDescriptors));
    }

    private SyncResult sync(Long providerId, SyncRequest syncRequest) {
        return syncEngine.syncProvider(providerId, syncRequest, CancellationSignal.none()).orTimeout(TIMEOUT_SECONDS, TimeUnit.SECONDS).join();
    }

    private List<String> catalogFileIds(Long providerId) {
        return catalogItemDao.findByProvider(providerId).stream().map(CatalogItem::getRemoteFileId).collect(Collectors.toList());
    }

    @Test
    public void newFilesAreAddedOnce() throws IOException {
        ProviderRecord provider = createProvider("Photos");
        registerBackend(provider, files(file("a.jpg", 10), file("2024/b.jpg", 20), file("2024/c.jpg", 30)));

        SyncResult firstResult = sync(provider.getId(), new SyncRequest());
        assertTrue(firstResult.isSuccess());
        assertEquals("Photos", firstResult.getProviderName());
        assertEquals(3, firstResult.getFilesAdded());
        assertEquals(3, firstResult.getTotalFilesFound());
        assertEquals(3, firstResult.getTotalFilesProcessed());
        assertThat(catalogFileIds(provider.getId()), containsInAnyOrder("a.jpg", "2024/b.jpg", "2024/c.jpg"));
        CatalogItem item = catalogItemDao.findByProviderAndRemoteFileId(provider.getId(), "2024/b.jpg").get();
        assertEquals("b.jpg", item.getFileName());
        assertEquals(20, item.getSize());
        assertEquals("/media/2024/b.jpg", item.getLocalPath());
        assertNotNull(item.getFirstSeenDate());
        assertNotNull(providerRecordDao.findById(provider.getId()).getLastSyncDate());

        SyncResult secondResult = sync(provider.getId(), new SyncRequest());
        assertTrue(secondResult.isSuccess());
        assertEquals(0, secondResult.getFilesAdded());
        assertEquals(0, secondResult.getFilesUpdated());
        assertEquals(0, secondResult.getFilesRemoved());
        assertEquals(3, secondResult.getFilesSkipped());
        assertEquals(3, catalogItemDao.countAll());
    }

    @Test
    public void changedFilesAreUpdatedOnlyWhenCompared() throws IOException {
        ProviderRecord provider = createProvider("Photos");
        List<FileDescriptor> listing = files(file("a.jpg", 10), file("b.jpg", 20));
        registerBackend(provider, listing);
        sync(provider.getId(), new SyncRequest());

        listing.set(0, file("a.jpg", 15));
        SyncResult skipExistingResult = sync(provider.getId(), new SyncRequest());
        assertEquals(0, skipExistingResult.getFilesUpdated());
        assertEquals(2, skipExistingResult.getFilesSkipped());
        assertEquals(10, catalogItemDao.findByProviderAndRemoteFileId(provider.getId(), "a.jpg").get().getSize());

        SyncResult compareResult = sync(provider.getId(), new SyncRequest().setSkipExisting(false));
        assertEquals(1, compareResult.getFilesUpdated());
        assertEquals(1, compareResult.getFilesSkipped());
        assertEquals(15, catalogItemDao.findByProviderAndRemoteFileId(provider.getId(), "a.jpg").get().getSize());

        listing.set(1, file("b.jpg", 25));
        SyncResult fullSyncResult = sync(provider.getId(), new SyncRequest().setFullSync(true));
        assertEquals(1, fullSyncResult.getFilesUpdated());
        assertEquals(25, catalogItemDao.findByProviderAndRemoteFileId(provider.getId(), "b.jpg").get().getSize());
        assertEquals(2, catalogItemDao.countAll());
    }

    @Test
    public void vanishedFilesAreRemovedUnlessKept() throws IOException {
        ProviderRecord provider = createProvider("Photos");
        List<FileDescriptor> listing = files(file("a.jpg", 10), file("b.jpg", 20), file("c.jpg", 30));
        registerBackend(provider, listing);
        sync(provider.getId(), new SyncRequest());

        listing.remove(1);
        SyncResult keepResult = sync(provider.getId(), new SyncRequest().setRemoveDeleted(false));
        assertEquals(0, keepResult.getFilesRemoved());
        assertEquals(3, catalogItemDao.countAll());

        SyncResult removeResult = sync(provider.getId(), new SyncRequest());
        assertEquals(1, removeResult.getFilesRemoved());
        assertEquals(2, removeResult.getFilesSkipped());
        assertThat(catalogFileIds(provider.getId()), containsInAnyOrder("a.jpg", "c.jpg"));
    }

    @Test
    public void otherProvidersAreNotTouched() throws IOException {
        ProviderRecord provider = createProvider("Photos");
        ProviderRecord otherProvider = createProvider("Other");
        registerBackend(provider, files(file("a.jpg", 10)));
        registerBackend(otherProvider, files(file("a.jpg", 10), file("z.jpg", 10)));
        sync(otherProvider.getId(), new SyncRequest());

        SyncResult result = sync(provider.getId(), new SyncRequest());
        assertEquals(1, result.getFilesAdded());
        assertEquals(0, result.getFilesRemoved());
        assertThat(catalogFileIds(otherProvider.getId()), containsInAnyOrder("a.jpg", "z.jpg"));
    }

    @Test
    public void maxFilesLimitsAdditions() throws IOException {
        ProviderRecord provider = createProvider("Photos");
        registerBackend(provider, files(file("a.jpg", 1), file("b.jpg", 2), file("c.jpg", 3), file("d.jpg", 4)));

        SyncResult limitedResult = sync(provider.getId(), new SyncRequest().setMaxFiles(2));
        assertTrue(limitedResult.isSuccess());
        assertEquals(2, limitedResult.getFilesAdded());
        assertEquals(4, limitedResult.getTotalFilesFound());
        assertThat(catalogFileIds(provider.getId()), containsInAnyOrder("a.jpg", "b.jpg"));

        SyncResult nextResult = sync(provider.getId(), new SyncRequest().setMaxFiles(2));
        assertEquals(2, nextResult.getFilesAdded());
        assertEquals(2, nextResult.getFilesSkipped());
        assertEquals(4, catalogItemDao.countAll());
    }

    @Test
    public void foldersAndDuplicatesAreSkipped() throws IOException {
        ProviderRecord provider = createProvider("Photos");
        FileDescriptor folder = FileDescriptor.builder("2024").fileName("2024").folder(true).build();
        registerBackend(provider, files(folder, file("a.jpg", 1), file("a.jpg", 1)));

        SyncResult result = sync(provider.getId(), new SyncRequest());
        assertEquals(2, result.getTotalFilesFound());
        assertEquals(1, result.getFilesAdded());
        assertEquals(1, result.getFilesSkipped());
        assertThat(catalogFileIds(provider.getId()), contains("a.jpg"));
    }

    @Test
    public void folderAndRecursionArePassedToTheBackend() throws IOException {
        ProviderRecord provider = createProvider("Photos");
        StorageBackend backend = registerBackend(provider, files(file("2024/a.jpg", 1)));

        sync(provider.getId(), new SyncRequest().setFolderId("2024").setRecursive(false));
        Mockito.verify(backend).listFiles(eq("2024"), eq(false), any());
    }

    @Test
    public void perFileErrorsAreCollected() throws IOException {
        catalogItemDao = new InMemoryCatalogItemDao() {
            @Override
            public synchronized void save(CatalogItem entity) {
                if ("bad.jpg".equals(entity.getRemoteFileId())) {
                    throw new IllegalStateException("write failed");
                }
                super.save(entity);
            }
        };
        syncEngine = createSyncEngine(1);
        ProviderRecord provider = createProvider("Photos");
        registerBackend(provider, files(file("a.jpg", 1), file("bad.jpg", 2), file("c.jpg", 3)));

        SyncResult result = sync(provider.getId(), new SyncRequest());
        assertTrue(result.isSuccess());
        assertEquals(2, result.getFilesAdded());
        assertThat(result.getErrors(), hasSize(1));
        assertThat(result.getErrors().get(0), containsString("bad.jpg"));
    }

    @Test
    public void missingProvider() {
        SyncResult result = sync(999L, new SyncRequest());
        assertFalse(result.isSuccess());
        assertEquals(SyncResult.PROVIDER_NOT_FOUND, result.getErrorMessage());
        assertFalse(syncRunRegistry.isRunning(999L));

        SyncResult nullProviderResult = sync(null, new SyncRequest());
        assertFalse(nullProviderResult.isSuccess());
        assertEquals(SyncResult.PROVIDER_NOT_FOUND, nullProviderResult.getErrorMessage());
    }

    @Test
    public void backendFailureIsReported() throws IOException {
        ProviderRecord provider = createProvider("Photos");
        StorageBackend backend = registerBackend(provider, files());
        Mockito.when(backend.listFiles(any(), anyBoolean(), any())).thenThrow(new IOException("disk unavailable"));

        SyncResult result = sync(provider.getId(), new SyncRequest());
        assertFalse(result.isSuccess());
        assertFalse(result.isCancelled());
        assertEquals("disk unavailable", result.getErrorMessage());
        assertFalse(syncRunRegistry.isRunning(provider.getId()));
        assertNull(providerRecordDao.findById(provider.getId()).getLastSyncDate());
        assertSame(result, syncEngine.getSyncStatus(provider.getId()).getLastSyncResult());
    }

    @Test
    public void onlyOneSyncPerProvider() throws Exception {
        ProviderRecord provider = createProvider("Photos");
        StorageBackend backend = registerBackend(provider, files());
        CountDownLatch listingStarted = new CountDownLatch(1);
        CountDownLatch releaseListing = new CountDownLatch(1);
        Mockito.when(backend.listFiles(any(), anyBoolean(), any())).thenAnswer(invocation -> {
            listingStarted.countDown();
            releaseListing.await(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return ImmutableList.of(file("a.jpg", 1));
        });

        CompletableFuture<SyncResult> firstSync = syncEngine.syncProvider(provider.getId(), new SyncRequest(), CancellationSignal.none());
        assertTrue(listingStarted.await(TIMEOUT_SECONDS, TimeUnit.SECONDS));

        SyncStatus runningStatus = syncEngine.getSyncStatus(provider.getId());
        assertTrue(runningStatus.isInProgress());
        assertEquals("Scanning files...", runningStatus.getCurrentOperation());

        SyncResult concurrentResult = syncEngine.syncProvider(provider.getId(), new SyncRequest(), CancellationSignal.none()).join();
        assertFalse(concurrentResult.isSuccess());
        assertEquals(SyncResult.ALREADY_IN_PROGRESS, concurrentResult.getErrorMessage());

        releaseListing.countDown();
        SyncResult firstResult = firstSync.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertTrue(firstResult.isSuccess());
        assertEquals(1, firstResult.getFilesAdded());

        SyncStatus idleStatus = syncEngine.getSyncStatus(provider.getId());
        assertFalse(idleStatus.isInProgress());
        assertSame(firstResult, idleStatus.getLastSyncResult());
        assertTrue(sync(provider.getId(), new SyncRequest()).isSuccess());
    }

    @Test
    public void cancelledSyncReleasesTheProvider() throws Exception {
        ProviderRecord provider = createProvider("Photos");
        StorageBackend backend = registerBackend(provider, files());
        CountDownLatch listingStarted = new CountDownLatch(1);
        Mockito.when(backend.listFiles(any(), anyBoolean(), any())).thenAnswer(invocation -> {
            CancellationSignal cancellation = invocation.getArgument(2);
            listingStarted.countDown();
            long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS);
            while (!cancellation.isCancelled() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            cancellation.throwIfCancelled();
            return ImmutableList.of(file("a.jpg", 1));
        });

        CompletableFuture<SyncResult> runningSync = syncEngine.syncProvider(provider.getId(), new SyncRequest(), CancellationSignal.none());
        assertTrue(listingStarted.await(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertTrue(syncEngine.cancelSync(provider.getId()));

        SyncResult cancelledResult = runningSync.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertFalse(cancelledResult.isSuccess());
        assertTrue(cancelledResult.isCancelled());
        assertEquals(SyncResult.CANCELLED, cancelledResult.getErrorMessage());
        assertEquals(0, catalogItemDao.countAll());
        assertFalse(syncEngine.cancelSync(provider.getId()));

        Mockito.doReturn(ImmutableList.of(file("a.jpg", 1))).when(backend).listFiles(any(), anyBoolean(), any());
        SyncResult nextResult = sync(provider.getId(), new SyncRequest());
        assertTrue(nextResult.isSuccess());
        assertEquals(1, nextResult.getFilesAdded());
    }

    @Test
    public void cancelledFutureReleasesTheProviderBeforeTheRunStarts() throws Exception {
        ExecutorService singleThreadExecutor = Executors.newSingleThreadExecutor();
        try {
            SyncEngine singleThreadSyncEngine = new SyncEngine(backendRegistry, providerRecordDao, catalogItemDao, syncRunRegistry,
                    singleThreadExecutor, 1, 2, mock(Logger.class));
            ProviderRecord provider = createProvider("Photos");
            registerBackend(provider, files(file("a.jpg", 1)));
            CountDownLatch releaseExecutor = new CountDownLatch(1);
            singleThreadExecutor.execute(() -> {
                try {
                    releaseExecutor.await(TIMEOUT_SECONDS, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            CompletableFuture<SyncResult> pendingSync = singleThreadSyncEngine.syncProvider(provider.getId(), new SyncRequest(), CancellationSignal.none());
            assertTrue(pendingSync.cancel(true));
            assertTrue(syncRunRegistry.isRunning(provider.getId()));
            releaseExecutor.countDown();
            awaitIdle(provider.getId());

            assertEquals(0, catalogItemDao.countAll());
            assertTrue(syncEngine.getSyncStatus(provider.getId()).getLastSyncResult().isCancelled());
            SyncResult nextResult = sync(provider.getId(), new SyncRequest());
            assertTrue(nextResult.isSuccess());
            assertEquals(1, nextResult.getFilesAdded());
        } finally {
            singleThreadExecutor.shutdownNow();
        }
    }

    @Test
    public void cancellingTheReturnedFutureStopsARunningSync() throws Exception {
        ProviderRecord provider = createProvider("Photos");
        StorageBackend backend = registerBackend(provider, files());
        CountDownLatch listingStarted = new CountDownLatch(1);
        Mockito.when(backend.listFiles(any(), anyBoolean(), any())).thenAnswer(invocation -> {
            CancellationSignal cancellation = invocation.getArgument(2);
            listingStarted.countDown();
            long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS);
            while (!cancellation.isCancelled() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            cancellation.throwIfCancelled();
            return ImmutableList.of(file("a.jpg", 1));
        });

        CompletableFuture<SyncResult> runningSync = syncEngine.syncProvider(provider.getId(), new SyncRequest(), CancellationSignal.none());
        assertTrue(listingStarted.await(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertTrue(runningSync.cancel(true));
        awaitIdle(provider.getId());

        assertEquals(0, catalogItemDao.countAll());
        assertTrue(syncEngine.getSyncStatus(provider.getId()).getLastSyncResult().isCancelled());
    }

    private void awaitIdle(Long providerId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS);
        while (syncRunRegistry.isRunning(providerId) && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(syncRunRegistry.isRunning(providerId));
    }

    @Test
    public void callerCancellationStopsTheSync() throws IOException {
        ProviderRecord provider = createProvider("Photos");
        registerBackend(provider, files(file("a.jpg", 1)));
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.cancel();

        SyncResult result = syncEngine.syncProvider(provider.getId(), new SyncRequest(), cancellation).join();
        assertTrue(result.isCancelled());
        assertEquals(0, catalogItemDao.countAll());
        assertFalse(syncRunRegistry.isRunning(provider.getId()));
    }

    @Test
    public void idleStatusWithoutHistory() {
        SyncStatus status = syncEngine.getSyncStatus(5L);
        assertFalse(status.isInProgress());
        assertNull(status.getLastSyncResult());
        assertFalse(syncEngine.cancelSync(5L));
    }

    @Test
    public void scanReportsNewFilesWithoutChangingTheCatalog() throws IOException {
        ProviderRecord provider = createProvider("Photos");
        List<FileDescriptor> listing = files(file("a.jpg", 10));
        registerBackend(provider, listing);
        sync(provider.getId(), new SyncRequest());
        listing.add(file("b.jpg", 20));
        listing.add(file("c.jpg", 30));
        listing.add(file("d.jpg", 40));

        ScanResult scanResult = syncEngine.scanProvider(provider.getId(), CancellationSignal.none()).join();
        assertTrue(scanResult.isSuccess());
        assertEquals(4, scanResult.getTotalFilesFound());
        assertEquals(3, scanResult.getNewFilesCount());
        assertEquals(1, scanResult.getExistingFilesCount());
        assertEquals(90, scanResult.getNewFilesTotalSize());
        assertThat(scanResult.getSampleNewFiles(), hasSize(2));
        assertEquals(1, catalogItemDao.countAll());
    }

    @Test
    public void scanFailures() throws IOException {
        ScanResult notFound = syncEngine.scanProvider(999L, CancellationSignal.none()).join();
        assertFalse(notFound.isSuccess());
        assertEquals(SyncResult.PROVIDER_NOT_FOUND, notFound.getErrorMessage());

        ProviderRecord provider = createProvider("Photos");
        registerBackend(provider, files(file("a.jpg", 1)));
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.cancel();
        ScanResult cancelled = syncEngine.scanProvider(provider.getId(), cancellation).join();
        assertFalse(cancelled.isSuccess());
        assertEquals("Scan was cancelled", cancelled.getErrorMessage());
    }

    @Test
    public void syncAllIsolatesFailures() throws IOException {
        ProviderRecord good = createProvider("Good");
        ProviderRecord bad = createProvider("Bad");
        ProviderRecord other = createProvider("Other");
        StorageBackend goodBackend = registerBackend(good, files(file("a.jpg", 1)));
        StorageBackend badBackend = registerBackend(bad, files());
        StorageBackend otherBackend = registerBackend(other, files(file("b.jpg", 1), file("c.jpg", 1)));
        Mockito.when(badBackend.listFiles(any(), anyBoolean(), any())).thenThrow(new IOException("offline"));
        Mockito.when(backendRegistry.getAllBackends(any())).thenReturn(ImmutableList.of(goodBackend, badBackend, otherBackend));

        for (int maxConcurrentProviders : new int[] {1, 3}) {
            catalogItemDao.findAll().forEach(item -> catalogItemDao.deleteById(item.getId()));
            List<SyncResult> results = createSyncEngine(maxConcurrentProviders)
                    .syncAllProviders(new SyncRequest(), CancellationSignal.none())
                    .orTimeout(TIMEOUT_SECONDS, TimeUnit.SECONDS)
                    .join();
            assertThat(results.stream().map(SyncResult::getProviderId).collect(Collectors.toList()),
                    contains(good.getId(), bad.getId(), other.getId()));
            assertTrue(results.get(0).isSuccess());
            assertFalse(results.get(1).isSuccess());
            assertEquals("offline", results.get(1).getErrorMessage());
            assertTrue(results.get(2).isSuccess());
            assertEquals(2, results.get(2).getFilesAdded());
        }
    }

    @Test
    public void missingCancellationSignalMeansNotCancelled() throws IOException {
        ProviderRecord provider = createProvider("Photos");
        StorageBackend backend = registerBackend(provider, files(file("a.jpg", 1), file("b.jpg", 2)));
        Mockito.when(backendRegistry.getBackend(eq(provider.getId()), any())).thenAnswer(invocation -> {
            CancellationSignal cancellation = invocation.getArgument(1);
            cancellation.throwIfCancelled();
            return Optional.of(backend);
        });
        Mockito.when(backendRegistry.getAllBackends(any())).thenAnswer(invocation -> {
            CancellationSignal cancellation = invocation.getArgument(0);
            cancellation.throwIfCancelled();
            return ImmutableList.of(backend);
        });

        ScanResult scanResult = syncEngine.scanProvider(provider.getId(), null).orTimeout(TIMEOUT_SECONDS, TimeUnit.SECONDS).join();
        assertTrue(scanResult.isSuccess());
        assertEquals(2, scanResult.getNewFilesCount());

        List<SyncResult> results = syncEngine.syncAllProviders(new SyncRequest(), null).orTimeout(TIMEOUT_SECONDS, TimeUnit.SECONDS).join();
        assertThat(results, hasSize(1));
        assertTrue(results.get(0).isSuccess());
        assertEquals(2, results.get(0).getFilesAdded());
    }

    @Test
    public void filesWithoutRemoteIdAreIgnored() throws IOException {
        ProviderRecord provider = createProvider("Photos");
        FileDescriptor withoutId = FileDescriptor.builder(null).fileName("orphan.jpg").size(5).build();
        registerBackend(provider, files(file("a.jpg", 1), withoutId));

        for (int i = 0; i < 2; i++) {
            SyncResult result = sync(provider.getId(), new SyncRequest());
            assertTrue(result.isSuccess());
            assertEquals(1, result.getTotalFilesFound());
        }
        assertThat(catalogFileIds(provider.getId()), contains("a.jpg"));
    }

    @Test
    public void syncAllWithoutProviders() {
        Mockito.when(backendRegistry.getAllBackends(any())).thenThrow(new IllegalStateException("db down"));
        assertTrue(syncEngine.syncAllProviders(new SyncRequest(), CancellationSignal.none()).join().isEmpty());
    }
}
