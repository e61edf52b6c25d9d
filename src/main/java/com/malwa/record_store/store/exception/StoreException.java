package com.malwa.record_store.store.exception;

import java.time.Clock;
import java.time.Instant;

/**
 * Base class for every failure the record store reports to its callers.
 *
 * Carries the failure kind plus the offending collection and key (either may be null
 * when the failure is not tied to a single record) so that callers can render a
 * meaningful message without parsing exception text.
 */
public abstract class StoreException extends RuntimeException {

    private final ErrorKind kind;
    private final String collection;
    private final String key;

    protected StoreException(ErrorKind kind, String collection, String key, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.collection = collection;
        this.key = key;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCollection() {
        return collection;
    }

    public String getKey() {
        return key;
    }

    /**
     * Converts this exception to the structured error value handed to the UI layer.
     */
    public StoreError toError() {
        return toError(Clock.systemUTC());
    }

    /**
     * Same as {@link #toError()}, stamped with the time read from {@code clock}.
     */
    public StoreError toError(Clock clock) {
        return StoreError.builder()
            .kind(kind)
            .collection(collection)
            .key(key)
            .message(getMessage())
            .timestamp(Instant.now(clock))
            .build();
    }
}
