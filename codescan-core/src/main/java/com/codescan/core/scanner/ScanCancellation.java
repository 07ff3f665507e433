package com.codescan.core.scanner;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag of a scan.
 *
 * <p>Once cancelled, the orchestrator submits no further files and emits no further
 * progress. Files already submitted still run to completion and are aggregated.
 */
public final class ScanCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
