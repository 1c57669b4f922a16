package com.example.retrain.store;

/**
 * Durable pipeline state (sample log, attempt ledger, model pointer) cannot be read.
 * Fatal: callers surface it rather than continue with partial state.
 */
public class StorageCorruptedException extends RuntimeException {

    public StorageCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
