package org.janelia.mediasync.dataservice.cache;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.util.concurrent.Striped;
import org.apache.commons.lang3.StringUtils;
import org.janelia.mediasync.cdi.qualifier.LongPropertyValue;
import org.janelia.mediasync.cdi.qualifier.StrPropertyValue;
import org.janelia.mediasync.dao.CacheEntryDao;
import org.janelia.mediasync.model.CacheEntry;
import org.janelia.mediasync.model.page.PageRequest;
import org.janelia.mediasync.model.page.PageResult;
import org.janelia.mediasync.utils.CancellationSignal;
import org.slf4j.Logger;

/**
 * Content addressed, disk backed byte cache. Files are keyed by the SHA-256 of their content and stored as
 * <code>&lt;cacheDir&gt;/&lt;h[0..2]&gt;/&lt;h[2..4]&gt;/&lt;hash&gt;&lt;ext&gt;</code>; the bookkeeping rows live in
 * the {@link CacheEntryDao}. A hash is written at most once. When the total size exceeds the configured
 * limit the least recently accessed entries are evicted down to 80% of the limit.
 *
 * A file is always moved into place before its row is inserted and deleted before its row is removed, so a
 * crash can only leave a file without a row or a row without a file; {@link #repairIndex()} removes both.
 */
@ApplicationScoped
public class ContentCache {

    static final long DEFAULT_MAX_SIZE_BYTES = 5L * 1024 * 1024 * 1024;
    private static final double EVICTION_TARGET_RATIO = 0.8;
    private static final int BUFFER_SIZE = 64 * 1024;
    private static final String TEMP_SUFFIX = ".tmp";
    private static final Pattern HASH_PATTERN = Pattern.compile("[0-9a-f]{64}");
    private static final HashFunction HASH_FUNCTION = Hashing.sha256();

    private static final Map<String, String> CONTENT_TYPE_EXTENSIONS = ImmutableMap.<String, String>builder()
            .put("image/jpeg", ".jpg")
            .put("image/jpg", ".jpg")
            .put("image/png", ".png")
            .put("image/gif", ".gif")
            .put("image/webp", ".webp")
            .put("image/bmp", ".bmp")
            .put("video/mp4", ".mp4")
            .put("video/mpeg", ".mpeg")
            .put("video/quicktime", ".mov")
            .put("video/x-msvideo", ".avi")
            .build();

    private final CacheEntryDao cacheEntryDao;
    private final Path cacheDir;
    private final long maxCacheSizeBytes;
    private final Logger logger;
    private final Striped<Lock> hashLocks = Striped.lock(64);

    @Inject
    public ContentCache(CacheEntryDao cacheEntryDao,
                        @StrPropertyValue(name = "ContentCache.Directory", defaultValue = "mediasync-cache") String cacheDir,
                        @LongPropertyValue(name = "ContentCache.MaxSizeBytes", defaultValue = DEFAULT_MAX_SIZE_BYTES) long maxCacheSizeBytes,
                        Logger logger) {
        this.cacheEntryDao = cacheEntryDao;
        this.cacheDir = Paths.get(cacheDir).toAbsolutePath().normalize();
        this.maxCacheSizeBytes = maxCacheSizeBytes > 0 ? maxCacheSizeBytes : DEFAULT_MAX_SIZE_BYTES;
        this.logger = logger;
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    public long getMaxCacheSizeBytes() {
        return maxCacheSizeBytes;
    }

    /**
     * Computes the lower case hex SHA-256 of the remaining content of the stream and puts the stream back
     * to the position it had before, so the caller can read the same bytes again. The stream must either
     * support mark/reset or be a {@link FileInputStream}.
     */
    public String computeHash(InputStream stream, CancellationSignal cancellation) throws IOException {
        if (stream.markSupported()) {
            stream.mark(Integer.MAX_VALUE);
            try {
                return hashContent(stream, cancellation);
            } finally {
                stream.reset();
            }
        } else if (stream instanceof FileInputStream) {
            FileChannel channel = ((FileInputStream) stream).getChannel();
            long position = channel.position();
            try {
                return hashContent(stream, cancellation);
            } finally {
                channel.position(position);
            }
        } else {
            throw new IllegalArgumentException("Cannot compute the hash of a stream that cannot be re-read: " + stream.getClass().getName());
        }
    }

    private String hashContent(InputStream stream, CancellationSignal cancellation) throws IOException {
        Hasher hasher = HASH_FUNCTION.newHasher();
        byte[] buffer = new byte[BUFFER_SIZE];
        int n;
        while ((n = stream.read(buffer)) != -1) {
            cancellation.throwIfCancelled();
            hasher.putBytes(buffer, 0, n);
        }
        return hasher.hash().toString();
    }

    public CacheEntry cacheFile(String hash, InputStream content, String originReference, Long providerId,
                                String contentType, CancellationSignal cancellation) throws IOException {
        return cacheFile(hash, content, originReference, providerId, null, contentType, cancellation);
    }

    /**
     * Stores the content under the given hash. If the hash is already cached nothing is written and the
     * existing entry is returned.
     *
     * @throws IllegalArgumentException if the hash is malformed or does not match the content
     */
    public CacheEntry cacheFile(String hash, InputStream content, String originReference, Long providerId,
                                String providerFileId, String contentType, CancellationSignal cancellation) throws IOException {
        String contentHash = normalizeHash(hash);
        Preconditions.checkArgument(content != null, "Content stream is required");
        cancellation.throwIfCancelled();
        CacheEntry cacheEntry;
        boolean newEntry = false;
        Lock hashLock = hashLocks.get(contentHash);
        hashLock.lock();
        try {
            Optional<CacheEntry> existingEntry = lookupValidEntry(contentHash);
            if (existingEntry.isPresent()) {
                logger.debug("Content {} is already cached", contentHash);
                cacheEntry = existingEntry.get();
                if (StringUtils.isNotBlank(providerFileId) && StringUtils.isBlank(cacheEntry.getProviderFileId())) {
                    cacheEntry.setProviderId(providerId);
                    cacheEntry.setProviderFileId(providerFileId);
                    cacheEntryDao.save(cacheEntry);
                }
            } else {
                Path targetPath = getEntryPath(contentHash, contentType);
                long size = writeContent(contentHash, content, targetPath, cancellation);
                Date now = new Date();
                cacheEntry = new CacheEntry();
                cacheEntry.setHash(contentHash);
                cacheEntry.setLocalPath(targetPath.toString());
                cacheEntry.setSize(size);
                cacheEntry.setOriginReference(originReference);
                cacheEntry.setProviderId(providerId);
                cacheEntry.setProviderFileId(providerFileId);
                cacheEntry.setContentType(contentType);
                cacheEntry.setCachedDate(now);
                cacheEntry.setLastAccessedDate(now);
                cacheEntry.setAccessCount(1);
                if (cacheEntryDao.insertIfAbsent(cacheEntry)) {
                    newEntry = true;
                    logger.info("Cached {} ({} bytes) from {}", contentHash, size, originReference);
                } else {
                    // indexed concurrently by another process; the bytes are the same
                    cacheEntry = cacheEntryDao.findById(contentHash);
                }
            }
        } finally {
            hashLock.unlock();
        }
        if (newEntry) {
            enforceSizeLimit(cancellation);
        }
        return cacheEntry;
    }

    private Optional<CacheEntry> lookupValidEntry(String hash) throws IOException {
        CacheEntry cacheEntry = cacheEntryDao.findById(hash);
        if (cacheEntry == null) {
            return Optional.empty();
        } else if (Files.isRegularFile(Paths.get(cacheEntry.getLocalPath()))) {
            return Optional.of(cacheEntry);
        } else {
            logger.warn("Cached file {} for {} is missing - drop the entry", cacheEntry.getLocalPath(), hash);
            cacheEntryDao.deleteById(hash);
            return Optional.empty();
        }
    }

    private long writeContent(String hash, InputStream content, Path targetPath, CancellationSignal cancellation) throws IOException {
        Files.createDirectories(targetPath.getParent());
        Path tempPath = Files.createTempFile(targetPath.getParent(), hash, TEMP_SUFFIX);
        try {
            Hasher hasher = HASH_FUNCTION.newHasher();
            long size = 0;
            try (OutputStream tempStream = Files.newOutputStream(tempPath)) {
                byte[] buffer = new byte[BUFFER_SIZE];
                int n;
                while ((n = content.read(buffer)) != -1) {
                    cancellation.throwIfCancelled();
                    hasher.putBytes(buffer, 0, n);
                    tempStream.write(buffer, 0, n);
                    size += n;
                }
            }
            String writtenHash = hasher.hash().toString();
            if (!hash.equals(writtenHash)) {
                throw new IllegalArgumentException("Content hash mismatch: expected " + hash + " but the content hashes to " + writtenHash);
            }
            moveIntoPlace(tempPath, targetPath);
            return size;
        } finally {
            Files.deleteIfExists(tempPath);
        }
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void enforceSizeLimit(CancellationSignal cancellation) throws IOException {
        long currentSize = cacheEntryDao.totalSize();
        if (currentSize > maxCacheSizeBytes) {
            logger.info("Cache size {} exceeds the limit of {} bytes", currentSize, maxCacheSizeBytes);
            evictLRU((long) (maxCacheSizeBytes * EVICTION_TARGET_RATIO), cancellation);
        }
    }

    /**
     * Opens the cached content for reading and records the access.
     *
     * @return the content or empty if the hash is not cached
     */
    public Optional<InputStream> getCachedStream(String hash, CancellationSignal cancellation) throws IOException {
        cancellation.throwIfCancelled();
        Optional<CacheEntry> cacheEntry = getCachedEntry(hash);
        if (cacheEntry.isPresent()) {
            Path cachedPath = Paths.get(cacheEntry.get().getLocalPath());
            if (Files.isRegularFile(cachedPath)) {
                return Optional.of(Files.newInputStream(cachedPath));
            }
            deleteCachedFile(cacheEntry.get().getHash());
        }
        return Optional.empty();
    }

    /**
     * Looks up the entry and records the access.
     */
    public Optional<CacheEntry> getCachedEntry(String hash) {
        return cacheEntryDao.touch(normalizeHash(hash), new Date());
    }

    public Optional<CacheEntry> getCachedEntryByProviderFileId(Long providerId, String providerFileId) {
        return cacheEntryDao.findByProviderFileId(providerId, providerFileId)
                .flatMap(cacheEntry -> cacheEntryDao.touch(cacheEntry.getHash(), new Date()));
    }

    /**
     * Removes the least recently accessed entries until the total size is at or below the target.
     *
     * @return the number of evicted entries
     */
    public int evictLRU(long targetSizeBytes, CancellationSignal cancellation) throws IOException {
        long currentSize = cacheEntryDao.totalSize();
        if (currentSize <= targetSizeBytes) {
            return 0;
        }
        int evicted = 0;
        long freedSpace = 0;
        for (CacheEntry cacheEntry : cacheEntryDao.findAllOrderedByLastAccess()) {
            if (currentSize - freedSpace <= targetSizeBytes) {
                break;
            }
            cancellation.throwIfCancelled();
            if (removeEntry(cacheEntry)) {
                freedSpace += cacheEntry.getSize();
                evicted++;
            }
        }
        logger.info("Evicted {} cached files, freed {} bytes", evicted, freedSpace);
        return evicted;
    }

    /**
     * @return the number of removed entries
     */
    public int clearCache(CancellationSignal cancellation) throws IOException {
        return removeEntries(cacheEntryDao.findAll(), cancellation, "all");
    }

    public int clearProviderCache(Long providerId, CancellationSignal cancellation) throws IOException {
        return removeEntries(cacheEntryDao.findByProvider(providerId), cancellation, "provider " + providerId);
    }

    private int removeEntries(List<CacheEntry> cacheEntries, CancellationSignal cancellation, String scope) throws IOException {
        int removed = 0;
        for (CacheEntry cacheEntry : cacheEntries) {
            cancellation.throwIfCancelled();
            if (removeEntry(cacheEntry)) {
                removed++;
            }
        }
        logger.info("Cleared {} cached files for {}", removed, scope);
        return removed;
    }

    public boolean deleteCachedFile(String hash) throws IOException {
        CacheEntry cacheEntry = cacheEntryDao.findById(normalizeHash(hash));
        return cacheEntry != null && removeEntry(cacheEntry);
    }

    private boolean removeEntry(CacheEntry cacheEntry) throws IOException {
        Lock hashLock = hashLocks.get(cacheEntry.getHash());
        hashLock.lock();
        try {
            if (StringUtils.isNotBlank(cacheEntry.getLocalPath())) {
                Files.deleteIfExists(Paths.get(cacheEntry.getLocalPath()));
            }
            return cacheEntryDao.deleteById(cacheEntry.getHash());
        } finally {
            hashLock.unlock();
        }
    }

    public long getCacheSize() {
        return cacheEntryDao.totalSize();
    }

    public long getCacheCount() {
        return cacheEntryDao.countAll();
    }

    /**
     * @param page 1 based page number
     * @return cached entries, most recently accessed first
     */
    public PageResult<CacheEntry> listCachedFiles(int page, int pageSize) {
        Preconditions.checkArgument(pageSize > 0, "Page size must be positive");
        return cacheEntryDao.findMostRecentlyAccessed(new PageRequest(Math.max(page, 1) - 1, pageSize));
    }

    /**
     * Drops the rows whose file disappeared and deletes the files that have no row.
     *
     * @return the number of removed rows and files
     */
    public int repairIndex() throws IOException {
        int removedRows = 0;
        for (CacheEntry cacheEntry : cacheEntryDao.findAll()) {
            if (StringUtils.isBlank(cacheEntry.getLocalPath()) || !Files.isRegularFile(Paths.get(cacheEntry.getLocalPath()))) {
                if (removeEntry(cacheEntry)) {
                    removedRows++;
                }
            }
        }
        int removedFiles = 0;
        if (Files.isDirectory(cacheDir)) {
            List<Path> cachedFiles;
            try (Stream<Path> files = Files.walk(cacheDir)) {
                cachedFiles = files.filter(Files::isRegularFile).collect(Collectors.toList());
            }
            for (Path cachedFile : cachedFiles) {
                String fileName = cachedFile.getFileName().toString();
                String hash = StringUtils.left(fileName, 64);
                if (removeOrphanFile(hash, cachedFile)) {
                    removedFiles++;
                }
            }
        }
        logger.info("Repaired the cache index: removed {} rows without files and {} files without rows", removedRows, removedFiles);
        return removedRows + removedFiles;
    }

    private boolean removeOrphanFile(String hash, Path cachedFile) throws IOException {
        Lock hashLock = hashLocks.get(hash);
        hashLock.lock();
        try {
            CacheEntry cacheEntry = HASH_PATTERN.matcher(hash).matches() ? cacheEntryDao.findById(hash) : null;
            if (cacheEntry != null && cachedFile.equals(Paths.get(cacheEntry.getLocalPath()).toAbsolutePath().normalize())) {
                return false;
            }
            logger.debug("Remove orphan cache file {}", cachedFile);
            return Files.deleteIfExists(cachedFile);
        } finally {
            hashLock.unlock();
        }
    }

    Path getEntryPath(String hash, String contentType) {
        String extension = CONTENT_TYPE_EXTENSIONS.getOrDefault(StringUtils.lowerCase(StringUtils.trimToEmpty(contentType)), ".bin");
        return cacheDir.resolve(hash.substring(0, 2)).resolve(hash.substring(2, 4)).resolve(hash + extension);
    }

    private String normalizeHash(String hash) {
        String normalizedHash = StringUtils.lowerCase(StringUtils.trim(hash));
        Preconditions.checkArgument(normalizedHash != null && HASH_PATTERN.matcher(normalizedHash).matches(),
                "Invalid content hash: %s", hash);
        return normalizedHash;
    }
}
