package com.malwa.record_store.store.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StoreExceptionTest {

    @Test
    @DisplayName("Errors carry kind, collection and key for display")
    void testToError() {
        StoreError error = new RecordNotFoundException("customers", "c-1").toError();

        assertEquals(ErrorKind.NOT_FOUND, error.getKind());
        assertEquals("customers", error.getCollection());
        assertEquals("c-1", error.getKey());
        assertTrue(error.getMessage().contains("customers/c-1"));
        assertNotNull(error.getTimestamp());
    }

    @Test
    @DisplayName("Error timestamps are read from the supplied clock")
    void testToErrorWithClock() {
        Instant fixed = Instant.parse("2024-04-01T10:15:30Z");
        Clock clock = Clock.fixed(fixed, ZoneOffset.UTC);

        StoreError error = new RecordNotFoundException("vendors", "v-9").toError(clock);

        assertEquals(fixed, error.getTimestamp());
        assertEquals(ErrorKind.NOT_FOUND, error.getKind());
    }

    @Test
    @DisplayName("Constraint violations name the violated index")
    void testConstraintViolation() {
        ConstraintViolationException indexViolation =
                new ConstraintViolationException("vendors", "v-2", "code", null);
        ConstraintViolationException keyCollision =
                new ConstraintViolationException("vendors", "v-1", null, null);

        assertEquals("code", indexViolation.getIndexName());
        assertFalse(indexViolation.isPrimaryKeyCollision());
        assertTrue(indexViolation.getMessage().contains("vendors.code"));
        assertTrue(keyCollision.isPrimaryKeyCollision());
        assertEquals(ErrorKind.CONSTRAINT_VIOLATION, keyCollision.toError().getKind());
    }

    @Test
    @DisplayName("Aborted transactions report their collection scope and cause")
    void testTransactionAborted() {
        IllegalStateException cause = new IllegalStateException("disk full");

        TransactionAbortedException exception =
                TransactionAbortedException.of(List.of("customers", "customer_ledger_entries"), cause);

        assertEquals("customers,customer_ledger_entries", exception.getCollection());
        assertNull(exception.getKey());
        assertSame(cause, exception.getCause());
        assertTrue(exception.getMessage().contains("disk full"));
    }
}
