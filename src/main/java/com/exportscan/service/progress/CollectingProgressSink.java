package com.exportscan.service.progress;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps pass and note lines in order for display to the caller. Periodic counts are dropped.
 * Thread-safe.
 */
public class CollectingProgressSink implements ProgressSink {

    private final List<String> lines = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void passStarted(String description) {
        lines.add(description);
    }

    @Override
    public void progress(String pass, int processed, int total) {
        // not retained
    }

    @Override
    public void note(String message) {
        lines.add("NOTE: " + message);
    }

    public List<String> getLines() {
        synchronized (lines) {
            return List.copyOf(lines);
        }
    }
}
