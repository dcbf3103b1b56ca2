package org.janelia.mediasync.dataservice.storage;

/**
 * Raised by backends that do not support modifying their content.
 */
public class ReadOnlyBackendException extends UnsupportedOperationException {

    public ReadOnlyBackendException(String backendName, String operation) {
        super(backendName + " is read-only: " + operation + " is not supported");
    }
}
