package com.malwa.record_store.store.exception;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Structured error value for callers that display store failures.
 */
@Value
@Builder
public class StoreError {
    ErrorKind kind;
    String collection;
    String key;
    String message;
    Instant timestamp;
}
