package com.malwa.record_store.store.exception;

/**
 * Failure categories surfaced by the record store.
 */
public enum ErrorKind {
    NOT_FOUND,
    CONSTRAINT_VIOLATION,
    TRANSACTION_ABORTED,
    MIGRATION_FAILURE
}
