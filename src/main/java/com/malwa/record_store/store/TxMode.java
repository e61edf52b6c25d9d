package com.malwa.record_store.store;

/**
 * Access mode of a transaction scope.
 */
public enum TxMode {
    READ_ONLY,
    READ_WRITE
}
