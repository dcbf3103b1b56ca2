package org.janelia.mediasync.dataservice.storage;

/**
 * Optional capabilities a storage backend may declare.
 */
public enum BackendCapability {
    UPLOAD,
    DELETE,
    WATCH,
    OAUTH_DISCONNECT
}
