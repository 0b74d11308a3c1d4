package com.exportscan.service;

/**
 * Unexpected failure during a run. The run produced no partial result.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
