package org.janelia.mediasync.model;

/**
 * Persisted entity with an identifier.
 *
 * @param <I> identifier type
 */
public interface HasIdentifier<I> {
    I getId();
    void setId(I id);
}
