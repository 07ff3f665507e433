package com.codescan.core.scanner;

/**
 * Receives progress of a directory scan.
 *
 * <p>Called on the thread that started the scan. Percentages never decrease within one scan.
 */
@FunctionalInterface
public interface ScanProgressListener {

    /** Listener that ignores all events. */
    ScanProgressListener NONE = (message, percent) -> { };

    /**
     * Reports progress.
     *
     * @param message human-readable status
     * @param percent completion, 0 to 100
     */
    void onProgress(String message, int percent);
}
