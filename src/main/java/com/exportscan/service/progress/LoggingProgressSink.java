package com.exportscan.service.progress;

import lombok.extern.slf4j.Slf4j;

/**
 * Forwards progress to the application log.
 */
@Slf4j
public class LoggingProgressSink implements ProgressSink {

    @Override
    public void passStarted(String description) {
        log.info(description);
    }

    @Override
    public void progress(String pass, int processed, int total) {
        log.debug("{}: {}/{} records", pass, processed, total);
    }

    @Override
    public void note(String message) {
        log.info(message);
    }
}
