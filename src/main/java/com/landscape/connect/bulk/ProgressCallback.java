package com.landscape.connect.bulk;

/**
 * Callback for tracking progress of bulk distance transfers.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed records processed so far
     * @param total     total records, or -1 if unknown
     * @param message   optional progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
