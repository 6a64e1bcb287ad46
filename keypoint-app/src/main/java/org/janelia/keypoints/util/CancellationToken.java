package org.janelia.keypoints.util;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop request shared between a long running loop and whoever wants it to stop
 * (e.g. a signal handling shutdown hook). Loops check the token between units of work.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled;

    public CancellationToken() {
        this.cancelled = new AtomicBoolean(false);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
