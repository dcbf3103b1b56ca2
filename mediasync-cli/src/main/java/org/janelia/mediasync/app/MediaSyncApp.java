package org.janelia.mediasync.app;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.se.SeContainer;
import jakarta.inject.Inject;

import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.janelia.mediasync.asyncservice.sync.SyncEngine;
import org.janelia.mediasync.cdi.SeContainerFactory;
import org.janelia.mediasync.dataservice.cache.ContentCache;
import org.janelia.mediasync.utils.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is the bootstrap application for the media sync commands.
 */
@ApplicationScoped
public class MediaSyncApp {

    private static final Logger LOG = LoggerFactory.getLogger(MediaSyncApp.class);

    private final SyncEngine syncEngine;
    private final ContentCache contentCache;
    private final ObjectMapper objectMapper;

    @Inject
    public MediaSyncApp(SyncEngine syncEngine, ContentCache contentCache, ObjectMapper objectMapper) {
        this.syncEngine = syncEngine;
        this.contentCache = contentCache;
        this.objectMapper = objectMapper;
    }

    public static void main(String[] args) {
        MediaSyncArgs mediaSyncArgs;
        try {
            mediaSyncArgs = MediaSyncArgs.parse(args);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            System.err.println(new MediaSyncArgs().usage());
            System.exit(1);
            return;
        }
        if (mediaSyncArgs.shouldDisplayUsage()) {
            System.out.println(mediaSyncArgs.usage());
            return;
        }
        int exitCode;
        try {
            SeContainer container = SeContainerFactory.getSeContainer();
            MediaSyncApp app = container.select(MediaSyncApp.class).get();
            CancellationSignal cancellation = new CancellationSignal();
            Runtime.getRuntime().addShutdownHook(new Thread(cancellation::cancel));
            Object result = app.run(mediaSyncArgs, cancellation);
            System.out.println(app.toJson(result));
            exitCode = 0;
        } catch (Throwable e) {
            LOG.error("Error running {}", mediaSyncArgs.getCommand(), e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    Object run(MediaSyncArgs mediaSyncArgs, CancellationSignal cancellation) throws IOException {
        String command = mediaSyncArgs.getCommand();
        LOG.info("Run {}", command);
        switch (command) {
            case MediaSyncArgs.SYNC_CMD:
                SyncCommandArgs syncArgs = mediaSyncArgs.syncArgs;
                CompletableFuture<?> syncResult = syncArgs.providerId == null
                        ? syncEngine.syncAllProviders(syncArgs.toSyncRequest(), cancellation)
                        : syncEngine.syncProvider(syncArgs.providerId, syncArgs.toSyncRequest(), cancellation);
                return syncResult.join();
            case MediaSyncArgs.SCAN_CMD:
                return syncEngine.scanProvider(mediaSyncArgs.scanArgs.providerId, cancellation).join();
            case MediaSyncArgs.CACHE_STATS_CMD:
                return cacheStats();
            case MediaSyncArgs.CACHE_EVICT_CMD:
                int evicted = contentCache.evictLRU(mediaSyncArgs.cacheEvictArgs.targetSizeBytes, cancellation);
                Map<String, Object> evictResult = cacheStats();
                evictResult.put("evicted", evicted);
                return evictResult;
            case MediaSyncArgs.CACHE_CLEAR_CMD:
                int cleared = contentCache.clearCache(cancellation);
                Map<String, Object> clearResult = cacheStats();
                clearResult.put("cleared", cleared);
                return clearResult;
            default:
                throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    private Map<String, Object> cacheStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("cacheDir", contentCache.getCacheDir().toString());
        stats.put("count", contentCache.getCacheCount());
        stats.put("sizeBytes", contentCache.getCacheSize());
        stats.put("maxSizeBytes", contentCache.getMaxCacheSizeBytes());
        return stats;
    }

    String toJson(Object result) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
    }
}
