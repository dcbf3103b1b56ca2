package org.janelia.mediasync.dataservice.storage;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.apache.commons.io.IOUtils;
import org.janelia.mediasync.model.StorageBackendKind;
import org.janelia.mediasync.utils.CancellationSignal;

/**
 * Access to one storage origin. Instances are created and cached by the {@link BackendRegistry}.
 *
 * <p>File level failures are reported with checked exceptions: {@link java.nio.file.NoSuchFileException}
 * when an id is unknown and {@link java.nio.file.AccessDeniedException} when an id resolves outside of
 * what the backend is allowed to touch. Backends that cannot modify their content throw
 * {@link ReadOnlyBackendException} from {@link #upload} and {@link #delete}. All operations throw
 * {@link java.util.concurrent.CancellationException} once the given signal is cancelled.
 */
public interface StorageBackend {

    Long getProviderId();

    StorageBackendKind getKind();

    String getDisplayName();

    /**
     * Binds the provider identity and parses its configuration. Null, empty or malformed
     * configurations fall back to the backend defaults.
     */
    void initialize(Long providerId, String displayName, String configuration);

    Set<BackendCapability> getCapabilities();

    default boolean supportsUpload() {
        return getCapabilities().contains(BackendCapability.UPLOAD);
    }

    default boolean supportsWatch() {
        return getCapabilities().contains(BackendCapability.WATCH);
    }

    /**
     * Looks up an optional capability object, e.g. {@link OAuthConnection}.
     *
     * @return the capability if the backend offers it
     */
    default <C> Optional<C> lookupCapability(Class<C> capabilityType) {
        if (capabilityType.isInstance(this)) {
            return Optional.of(capabilityType.cast(this));
        } else {
            return Optional.empty();
        }
    }

    default List<FileDescriptor> listFiles(String folderId, CancellationSignal cancellation) throws IOException {
        return listFiles(folderId, true, cancellation);
    }

    /**
     * Lists the files under the given folder, or under the backend root if folderId is null.
     */
    List<FileDescriptor> listFiles(String folderId, boolean recursive, CancellationSignal cancellation) throws IOException;

    UploadResult upload(String fileName, InputStream content, String contentType, CancellationSignal cancellation) throws IOException;

    default byte[] download(String remoteFileId, CancellationSignal cancellation) throws IOException {
        try (InputStream contentStream = openReadStream(remoteFileId, cancellation)) {
            return IOUtils.toByteArray(contentStream);
        }
    }

    /**
     * The caller owns and must close the returned stream.
     */
    InputStream openReadStream(String remoteFileId, CancellationSignal cancellation) throws IOException;

    /**
     * @return false if there was nothing to delete
     */
    boolean delete(String remoteFileId, CancellationSignal cancellation) throws IOException;

    boolean fileExists(String remoteFileId, CancellationSignal cancellation) throws IOException;

    /**
     * Checks that the backend is reachable and usable with the current configuration. Ordinary
     * connectivity or credential problems return false.
     */
    boolean testConnection(CancellationSignal cancellation);
}
