package org.janelia.mediasync.dataservice.storage;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.janelia.mediasync.model.MediaKind;

/**
 * Classifies media files by extension.
 */
@ApplicationScoped
public class MediaFileScanner {

    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";
    private static final int MAX_NAME_COLLISIONS = 999;
    private static final DateTimeFormatter COLLISION_TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final Set<String> IMAGE_EXTENSIONS = ImmutableSet.of(
            "jpg", "jpeg", "png", "gif", "webp", "bmp", "tiff", "tif", "heic", "heif", "avif");

    private static final Set<String> VIDEO_EXTENSIONS = ImmutableSet.of(
            "mp4", "mov", "avi", "mkv", "webm", "m4v", "3gp", "wmv", "flv");

    private static final Map<String, String> CONTENT_TYPES = ImmutableMap.<String, String>builder()
            .put("jpg", "image/jpeg")
            .put("jpeg", "image/jpeg")
            .put("png", "image/png")
            .put("gif", "image/gif")
            .put("webp", "image/webp")
            .put("bmp", "image/bmp")
            .put("tiff", "image/tiff")
            .put("tif", "image/tiff")
            .put("heic", "image/heic")
            .put("heif", "image/heif")
            .put("avif", "image/avif")
            .put("mp4", "video/mp4")
            .put("mov", "video/quicktime")
            .put("avi", "video/x-msvideo")
            .put("mkv", "video/x-matroska")
            .put("webm", "video/webm")
            .put("m4v", "video/x-m4v")
            .put("3gp", "video/3gpp")
            .put("wmv", "video/x-ms-wmv")
            .put("flv", "video/x-flv")
            .build();

    public boolean isSupportedMediaFile(String fileName) {
        return isSupportedImage(fileName) || isSupportedVideo(fileName);
    }

    public boolean isSupportedImage(String fileName) {
        return IMAGE_EXTENSIONS.contains(getExtension(fileName));
    }

    public boolean isSupportedVideo(String fileName) {
        return VIDEO_EXTENSIONS.contains(getExtension(fileName));
    }

    public MediaKind getMediaKind(String fileName) {
        return isSupportedVideo(fileName) ? MediaKind.VIDEO : MediaKind.PHOTO;
    }

    public String getContentType(String fileName) {
        return CONTENT_TYPES.getOrDefault(getExtension(fileName), DEFAULT_CONTENT_TYPE);
    }

    /**
     * Returns a file name, derived from the original one, that does not exist yet in the target directory.
     * Characters that are not safe in a file name are replaced and on collision a timestamp and a counter
     * are appended to the base name.
     */
    public String generateUniqueFilename(String originalFileName, Path targetDir) {
        String baseName = sanitize(FilenameUtils.getBaseName(originalFileName));
        String extension = FilenameUtils.getExtension(originalFileName);
        String extensionSuffix = StringUtils.isEmpty(extension) ? "" : "." + extension;
        if (StringUtils.isBlank(baseName)) {
            baseName = "photo";
        }
        String candidate = baseName + extensionSuffix;
        if (Files.notExists(targetDir.resolve(candidate))) {
            return candidate;
        }
        String timestamp = ZonedDateTime.now(ZoneOffset.UTC).format(COLLISION_TIMESTAMP_FORMAT);
        for (int counter = 1; counter <= MAX_NAME_COLLISIONS; counter++) {
            candidate = String.format("%s_%s_%03d%s", baseName, timestamp, counter, extensionSuffix);
            if (Files.notExists(targetDir.resolve(candidate))) {
                return candidate;
            }
        }
        return baseName + "_" + UUID.randomUUID().toString().replace("-", "") + extensionSuffix;
    }

    private String getExtension(String fileName) {
        return StringUtils.lowerCase(FilenameUtils.getExtension(fileName));
    }

    private String sanitize(String name) {
        if (name == null) {
            return null;
        }
        return name.replaceAll("[\\\\/:*?\"<>|\\x00-\\x1F]+", "_")
                .replaceAll("^[._]+|_+$", "");
    }
}
