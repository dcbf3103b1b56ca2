package org.janelia.mediasync.model;

/**
 * Kinds of storage backends. The code is what gets persisted with a provider record.
 */
public enum StorageBackendKind {
    LOCAL(0),
    REMOTE_PICKER(1),
    GOOGLE_DRIVE(2),
    ONE_DRIVE(3);

    private final int code;

    StorageBackendKind(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static StorageBackendKind fromCode(int code) {
        for (StorageBackendKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown storage backend kind: " + code);
    }
}
