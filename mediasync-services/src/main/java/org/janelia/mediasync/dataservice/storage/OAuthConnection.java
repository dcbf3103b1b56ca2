package org.janelia.mediasync.dataservice.storage;

import org.janelia.mediasync.model.ProviderRecord;

/**
 * Capability of backends that hold OAuth credentials in their provider configuration.
 */
public interface OAuthConnection {
    /**
     * Clears the stored tokens from the record's configuration and disables the record. The caller is
     * responsible for persisting the record and invalidating the cached backend.
     *
     * @return true if the configuration was cleaned up, false if it could not be parsed (the record
     * is disabled either way)
     */
    boolean disconnect(ProviderRecord providerRecord);
}
