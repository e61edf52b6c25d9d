package com.malwa.record_store.store.exception;

import java.util.Collection;

/**
 * Thrown when a transaction was rolled back because of an engine failure or an
 * error raised by the transaction body. None of its writes are visible.
 */
public class TransactionAbortedException extends StoreException {

    public TransactionAbortedException(String collection, String key, String message, Throwable cause) {
        super(ErrorKind.TRANSACTION_ABORTED, collection, key, message, cause);
    }

    public static TransactionAbortedException of(Collection<String> collections, Throwable cause) {
        String scope = String.join(",", collections);
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new TransactionAbortedException(scope, null,
            String.format("Transaction over [%s] aborted: %s", scope, reason), cause);
    }
}
