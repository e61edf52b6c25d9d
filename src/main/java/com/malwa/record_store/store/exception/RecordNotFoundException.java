package com.malwa.record_store.store.exception;

/**
 * Thrown when an operation requires a record that does not exist.
 */
public class RecordNotFoundException extends StoreException {

    public RecordNotFoundException(String collection, String key) {
        super(ErrorKind.NOT_FOUND, collection, key,
            String.format("Record not found: %s/%s", collection, key), null);
    }
}
