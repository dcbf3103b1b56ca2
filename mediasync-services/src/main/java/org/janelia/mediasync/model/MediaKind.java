package org.janelia.mediasync.model;

public enum MediaKind {
    PHOTO,
    VIDEO
}
