package org.janelia.mediasync.dataservice.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.janelia.mediasync.model.StorageBackendKind;
import org.janelia.mediasync.utils.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Storage backend for a directory tree on the local file system. Every file id is a path relative to
 * the configured base path and may not leave it.
 */
public class LocalStorageBackend implements StorageBackend {

    private static final Logger LOG = LoggerFactory.getLogger(LocalStorageBackend.class);

    private static final String THUMBNAILS_DIR = ".thumbnails";
    private static final int COPY_BUFFER_SIZE = 64 * 1024;

    private final MediaFileScanner mediaFileScanner;
    private final ObjectMapper objectMapper;
    private final String defaultBasePath;

    private Long providerId;
    private String displayName = "Local Storage";
    private LocalStorageConfiguration configuration;
    private PathSandbox sandbox;

    public LocalStorageBackend(MediaFileScanner mediaFileScanner, ObjectMapper objectMapper, String defaultBasePath) {
        this.mediaFileScanner = mediaFileScanner;
        this.objectMapper = objectMapper;
        this.defaultBasePath = defaultBasePath;
        applyConfiguration(new LocalStorageConfiguration(defaultBasePath));
    }

    @Override
    public Long getProviderId() {
        return providerId;
    }

    @Override
    public StorageBackendKind getKind() {
        return StorageBackendKind.LOCAL;
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }

    public LocalStorageConfiguration getConfiguration() {
        return configuration;
    }

    public Path getBasePath() {
        return sandbox.getRoot();
    }

    @Override
    public void initialize(Long providerId, String displayName, String configurationBlob) {
        this.providerId = providerId;
        if (StringUtils.isNotBlank(displayName)) {
            this.displayName = displayName;
        }
        LocalStorageConfiguration parsedConfiguration = null;
        if (StringUtils.isNotBlank(configurationBlob)) {
            try {
                parsedConfiguration = objectMapper.readValue(configurationBlob, LocalStorageConfiguration.class);
            } catch (JsonProcessingException e) {
                LOG.warn("Failed to parse local storage configuration for provider {}, using defaults", providerId, e);
            }
        }
        if (parsedConfiguration == null) {
            parsedConfiguration = new LocalStorageConfiguration(defaultBasePath);
        } else if (StringUtils.isBlank(parsedConfiguration.getBasePath())) {
            parsedConfiguration.setBasePath(defaultBasePath);
        }
        applyConfiguration(parsedConfiguration);
    }

    private void applyConfiguration(LocalStorageConfiguration localStorageConfiguration) {
        this.configuration = localStorageConfiguration;
        this.sandbox = new PathSandbox(Paths.get(StringUtils.defaultIfBlank(localStorageConfiguration.getBasePath(), ".")));
    }

    @Override
    public Set<BackendCapability> getCapabilities() {
        return configuration.isWatchForChanges()
                ? EnumSet.of(BackendCapability.UPLOAD, BackendCapability.DELETE, BackendCapability.WATCH)
                : EnumSet.of(BackendCapability.UPLOAD, BackendCapability.DELETE);
    }

    @Override
    public List<FileDescriptor> listFiles(String folderId, boolean recursive, CancellationSignal cancellation) throws IOException {
        cancellation.throwIfCancelled();
        Path targetDir = sandbox.resolve(folderId);
        if (!Files.isDirectory(targetDir)) {
            LOG.warn("Directory {} does not exist", targetDir);
            return Collections.emptyList();
        }
        try (Stream<Path> files = Files.walk(targetDir, recursive ? Integer.MAX_VALUE : 1)) {
            return files
                    .peek(p -> cancellation.throwIfCancelled())
                    .filter(Files::isRegularFile)
                    .filter(p -> mediaFileScanner.isSupportedMediaFile(p.getFileName().toString()))
                    .filter(p -> !isThumbnailPath(sandbox.toFileId(p)))
                    .map(this::describeFile)
                    .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private FileDescriptor describeFile(Path filePath) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(filePath, BasicFileAttributes.class);
            String fileId = sandbox.toFileId(filePath);
            String fileName = filePath.getFileName().toString();
            String parentFolderId = StringUtils.defaultIfEmpty(FilenameUtils.getPathNoEndSeparator(fileId), null);
            return FileDescriptor.builder(fileId)
                    .fileName(fileName)
                    .fullPath(filePath.toString())
                    .size(attributes.size())
                    .mediaKind(mediaFileScanner.getMediaKind(fileName))
                    .contentType(mediaFileScanner.getContentType(fileName))
                    .createdDate(new Date(attributes.creationTime().toMillis()))
                    .modifiedDate(new Date(attributes.lastModifiedTime().toMillis()))
                    .parentFolderId(parentFolderId)
                    .build();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public UploadResult upload(String fileName, InputStream content, String contentType, CancellationSignal cancellation) throws IOException {
        cancellation.throwIfCancelled();
        // rejects traversal and absolute names before anything is written
        sandbox.resolve(fileName);
        String originalName = FilenameUtils.getName(StringUtils.replaceChars(fileName, '\\', '/'));
        if (!mediaFileScanner.isSupportedMediaFile(originalName)) {
            return UploadResult.failed("Unsupported file type: ." + FilenameUtils.getExtension(originalName));
        }
        String relativeDir = "";
        if (configuration.isOrganizeByDate()) {
            ZonedDateTime now = ZonedDateTime.now(ZoneOffset.UTC);
            relativeDir = String.format("%04d/%02d", now.getYear(), now.getMonthValue());
        }
        Path targetDir = sandbox.resolve(relativeDir);
        Files.createDirectories(targetDir);
        String uniqueFileName = mediaFileScanner.generateUniqueFilename(originalName, targetDir);
        Path targetPath = targetDir.resolve(uniqueFileName);
        long size = 0;
        try (OutputStream targetStream = Files.newOutputStream(targetPath, StandardOpenOption.CREATE_NEW)) {
            byte[] buffer = new byte[COPY_BUFFER_SIZE];
            int n;
            while ((n = content.read(buffer)) != -1) {
                cancellation.throwIfCancelled();
                targetStream.write(buffer, 0, n);
                size += n;
            }
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(targetPath);
            throw e;
        }
        String fileId = sandbox.toFileId(targetPath);
        LOG.info("Uploaded {} to {}", uniqueFileName, fileId);
        return UploadResult.uploaded(fileId, uniqueFileName, size,
                StringUtils.defaultIfBlank(contentType, mediaFileScanner.getContentType(uniqueFileName)));
    }

    @Override
    public InputStream openReadStream(String remoteFileId, CancellationSignal cancellation) throws IOException {
        cancellation.throwIfCancelled();
        Path filePath = sandbox.resolve(remoteFileId);
        if (!Files.isRegularFile(filePath)) {
            throw new NoSuchFileException(remoteFileId, null, "File not found");
        }
        return Files.newInputStream(filePath);
    }

    @Override
    public boolean delete(String remoteFileId, CancellationSignal cancellation) throws IOException {
        cancellation.throwIfCancelled();
        Path filePath = sandbox.resolve(remoteFileId);
        if (!Files.isRegularFile(filePath)) {
            return false;
        }
        boolean deleted = Files.deleteIfExists(filePath);
        if (deleted) {
            LOG.info("Deleted {} from {}", remoteFileId, sandbox.getRoot());
        }
        return deleted;
    }

    @Override
    public boolean fileExists(String remoteFileId, CancellationSignal cancellation) throws IOException {
        cancellation.throwIfCancelled();
        return Files.isRegularFile(sandbox.resolve(remoteFileId));
    }

    @Override
    public boolean testConnection(CancellationSignal cancellation) {
        cancellation.throwIfCancelled();
        Path root = sandbox.getRoot();
        try {
            Files.createDirectories(root);
            try (Stream<Path> rootContent = Files.list(root)) {
                rootContent.findFirst();
            }
            Path testFile = root.resolve(".mediasync-test-" + UUID.randomUUID().toString().replace("-", ""));
            Files.write(testFile, "test".getBytes(StandardCharsets.UTF_8));
            Files.delete(testFile);
            return true;
        } catch (IOException e) {
            LOG.warn("Local storage connection test failed for {}", root, e);
            return false;
        }
    }

    private static boolean isThumbnailPath(String fileId) {
        String normalized = StringUtils.stripStart(fileId, "/").toLowerCase();
        return normalized.equals(THUMBNAILS_DIR)
                || normalized.startsWith(THUMBNAILS_DIR + "/")
                || normalized.contains("/" + THUMBNAILS_DIR + "/");
    }
}
