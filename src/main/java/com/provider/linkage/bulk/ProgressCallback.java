package com.provider.linkage.bulk;

/**
 * Callback for tracking progress of long reads and writes.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed rows processed so far
     * @param total     total rows, or -1 when unknown
     * @param message   progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
