package org.janelia.mediasync.utils;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation handle. Long running operations poll it at their suspension points
 * and stop by throwing {@link CancellationException}.
 */
public class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal(null) {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("The empty cancellation signal cannot be cancelled");
        }
    };

    private final CancellationSignal parent;
    private volatile boolean cancelled;

    public CancellationSignal() {
        this(null);
    }

    private CancellationSignal(CancellationSignal parent) {
        this.parent = parent;
    }

    /**
     * @return a signal that is never cancelled
     */
    public static CancellationSignal none() {
        return NONE;
    }

    /**
     * Creates a child signal that is cancelled when either it or this signal gets cancelled.
     */
    public CancellationSignal newLinkedSignal() {
        return new CancellationSignal(this);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Operation was cancelled");
        }
    }
}
