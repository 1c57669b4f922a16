package com.example.retrain.policy;

/**
 * An operator request to retrain.
 *
 * @param note  free-text reason supplied by the caller, recorded in the ledger
 * @param force bypass data sufficiency and staleness checks
 */
public record ManualTrigger(String note, boolean force) {}
