package com.soccer.graph.ingest;

/**
 * Callback for tracking the progress of an ingestion run.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called to report progress.
     *
     * @param source    adapter name
     * @param processed records merged so far
     * @param message   progress message
     */
    void onProgress(String source, long processed, String message);

    ProgressCallback NOOP = (source, processed, message) -> {};
}
