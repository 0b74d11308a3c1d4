package com.exportscan.service.progress;

import java.util.List;

/**
 * Factory methods for common sinks.
 */
public final class ProgressSinks {

    private static final ProgressSink NO_OP = new ProgressSink() {
        @Override
        public void passStarted(String description) {
        }

        @Override
        public void progress(String pass, int processed, int total) {
        }

        @Override
        public void note(String message) {
        }
    };

    private ProgressSinks() {}

    public static ProgressSink noOp() {
        return NO_OP;
    }

    public static ProgressSink nullSafe(ProgressSink sink) {
        return sink == null ? NO_OP : sink;
    }

    /**
     * Fan out to every given sink in order.
     */
    public static ProgressSink composite(ProgressSink... sinks) {
        List<ProgressSink> targets = List.of(sinks);
        return new ProgressSink() {
            @Override
            public void passStarted(String description) {
                targets.forEach(s -> s.passStarted(description));
            }

            @Override
            public void progress(String pass, int processed, int total) {
                targets.forEach(s -> s.progress(pass, processed, total));
            }

            @Override
            public void note(String message) {
                targets.forEach(s -> s.note(message));
            }
        };
    }
}
