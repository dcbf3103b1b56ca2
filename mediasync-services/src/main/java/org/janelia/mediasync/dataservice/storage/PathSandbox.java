package org.janelia.mediasync.dataservice.storage;

import java.io.File;
import java.nio.file.AccessDeniedException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;

import com.google.common.base.Splitter;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolves backend file ids against a root directory and refuses anything that escapes it.
 * Both '/' and '\' are accepted as separators.
 */
public class PathSandbox {

    private static final Pattern DRIVE_OR_UNC_PREFIX = Pattern.compile("^([A-Za-z]:|//).*");

    private final Path root;

    public PathSandbox(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * @param fileId root relative path; an absolute path is accepted only if it lies inside the root
     * @return the resolved absolute path, the root itself for a blank id
     * @throws AccessDeniedException if the id contains a parent directory segment or resolves outside the root
     */
    public Path resolve(String fileId) throws AccessDeniedException {
        if (StringUtils.isBlank(fileId)) {
            return root;
        }
        String normalizedId = fileId.replace('\\', '/');
        for (String segment : Splitter.on('/').split(normalizedId)) {
            if ("..".equals(segment.trim())) {
                throw accessDenied(fileId);
            }
        }
        Path resolvedPath;
        try {
            if (normalizedId.startsWith("/") || DRIVE_OR_UNC_PREFIX.matcher(normalizedId).matches()) {
                Path absolutePath = Paths.get(fileId);
                if (!absolutePath.isAbsolute()) {
                    // a drive letter or UNC name on a file system that does not know about them
                    throw accessDenied(fileId);
                }
                resolvedPath = absolutePath.normalize();
            } else {
                resolvedPath = root.resolve(normalizedId.replace('/', File.separatorChar)).normalize();
            }
        } catch (InvalidPathException e) {
            throw accessDenied(fileId);
        }
        if (!resolvedPath.startsWith(root)) {
            throw accessDenied(fileId);
        }
        return resolvedPath;
    }

    /**
     * @return the root relative id of the given path, always using '/' as separator
     */
    public String toFileId(Path path) {
        return root.relativize(path.toAbsolutePath().normalize()).toString().replace(File.separatorChar, '/');
    }

    private AccessDeniedException accessDenied(String fileId) {
        return new AccessDeniedException(fileId, null, "Access to a path outside of the storage root is not allowed");
    }
}
