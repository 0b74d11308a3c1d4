package com.exportscan.service.progress;

/**
 * Observer for matching progress. Implementations must never influence outcomes.
 */
public interface ProgressSink {

    /**
     * A strategy pass is starting, e.g. "1. Matching by PO Number...".
     */
    void passStarted(String description);

    /**
     * Periodic progress within the current pass.
     */
    void progress(String pass, int processed, int total);

    /**
     * Informational note, such as a configuration fallback.
     */
    void note(String message);
}
