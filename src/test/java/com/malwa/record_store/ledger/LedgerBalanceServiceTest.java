package com.malwa.record_store.ledger;

import com.malwa.record_store.schema.ErpSchema;
import com.malwa.record_store.store.RecordFields;
import com.malwa.record_store.store.RecordStore;
import com.malwa.record_store.store.exception.RecordNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for balance recalculation, postings and statements.
 */
@SpringBootTest
class LedgerBalanceServiceTest {

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url",
                () -> "jdbc:h2:mem:ledger_balance_test;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    }

    @Autowired
    private LedgerBalanceService ledgerBalanceService;

    @Autowired
    private RecordStore recordStore;

    private String createEntity(LedgerType type, Object openingBalance) {
        Map<String, Object> entity = new HashMap<>();
        entity.put("name", type.name().toLowerCase() + "-" + UUID.randomUUID());
        if (openingBalance != null) {
            entity.put("opening_balance", openingBalance);
        }
        return (String) recordStore.insert(type.getEntityCollection(), entity).get("id");
    }

    private void addEntry(LedgerType type, String entityId, Object debit, Object credit, String date) {
        Map<String, Object> entry = new HashMap<>();
        entry.put(type.getOwnerField(), entityId);
        entry.put("entry_date", date);
        if (debit != null) {
            entry.put("debit", debit);
        }
        if (credit != null) {
            entry.put("credit", credit);
        }
        recordStore.insert(type.getLedgerCollection(), entry);
    }

    private BigDecimal storedBalance(LedgerType type, String entityId) {
        Map<String, Object> entity = recordStore.getById(type.getEntityCollection(), entityId).orElseThrow();
        return RecordFields.decimal(entity, "current_balance");
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Opening 1000 plus debit 500 minus credit 200 gives 1300")
    void testRecalculateBalance() {
        // Given: a customer with an opening balance and two ledger entries
        String customerId = createEntity(LedgerType.CUSTOMER, 1000);
        addEntry(LedgerType.CUSTOMER, customerId, 500, null, "2024-04-01");
        addEntry(LedgerType.CUSTOMER, customerId, null, 200, "2024-04-02");

        // When: recalculating
        Optional<BigDecimal> balance = ledgerBalanceService.recalculateBalance(LedgerType.CUSTOMER, customerId);

        // Then: the balance is stored on the customer
        assertTrue(balance.isPresent());
        assertAmount("1300", balance.get());
        assertAmount("1300", storedBalance(LedgerType.CUSTOMER, customerId));
    }

    @Test
    @DisplayName("Recalculating twice gives the same result")
    void testRecalculateBalance_Idempotent() {
        String vendorId = createEntity(LedgerType.VENDOR, 0);
        addEntry(LedgerType.VENDOR, vendorId, 120.5, 20.25, "2024-04-01");

        BigDecimal first = ledgerBalanceService.recalculateBalance(LedgerType.VENDOR, vendorId).orElseThrow();
        BigDecimal second = ledgerBalanceService.recalculateBalance(ErpSchema.VENDORS, vendorId).orElseThrow();

        assertAmount("100.25", first);
        assertEquals(0, first.compareTo(second));
        assertAmount("100.25", storedBalance(LedgerType.VENDOR, vendorId));
    }

    @Test
    @DisplayName("Recalculation repairs a balance that missed earlier updates")
    void testRecalculateBalance_SelfHealing() {
        String labourId = createEntity(LedgerType.LABOUR, 50);
        recordStore.update(ErpSchema.LABOUR, labourId, Map.of("current_balance", 99999));
        addEntry(LedgerType.LABOUR, labourId, 10, null, "2024-04-01");

        ledgerBalanceService.recalculateBalance(LedgerType.LABOUR, labourId);

        assertAmount("60", storedBalance(LedgerType.LABOUR, labourId));
    }

    @Test
    @DisplayName("Recalculating a vanished entity is a no-op")
    void testRecalculateBalance_MissingEntity() {
        String supplierId = "gone-" + UUID.randomUUID();
        addEntry(LedgerType.SUPPLIER, supplierId, 10, null, "2024-04-01");

        assertTrue(ledgerBalanceService.recalculateBalance(LedgerType.SUPPLIER, supplierId).isEmpty());
        assertTrue(recordStore.getById(ErpSchema.SUPPLIERS, supplierId).isEmpty());
    }

    @Test
    @DisplayName("Missing opening balance counts as zero and numeric strings are accepted")
    void testRecalculateBalance_LenientAmounts() {
        String supplierId = createEntity(LedgerType.SUPPLIER, null);
        addEntry(LedgerType.SUPPLIER, supplierId, "300.00", "", "2024-04-01");
        addEntry(LedgerType.SUPPLIER, supplierId, null, "100", "2024-04-02");

        assertAmount("200", ledgerBalanceService.recalculateBalance(LedgerType.SUPPLIER, supplierId).orElseThrow());
    }

    @Test
    @DisplayName("Entries of other entities are not counted")
    void testRecalculateBalance_OnlyOwnEntries() {
        String first = createEntity(LedgerType.CUSTOMER, 0);
        String second = createEntity(LedgerType.CUSTOMER, 0);
        addEntry(LedgerType.CUSTOMER, first, 100, null, "2024-04-01");
        addEntry(LedgerType.CUSTOMER, second, 7, null, "2024-04-01");

        assertAmount("100", ledgerBalanceService.recalculateBalance(LedgerType.CUSTOMER, first).orElseThrow());
        assertAmount("7", ledgerBalanceService.recalculateBalance(LedgerType.CUSTOMER, second).orElseThrow());
    }

    @Test
    @DisplayName("Collections without a ledger are rejected")
    void testRecalculateBalance_UnknownCollection() {
        assertThrows(IllegalArgumentException.class,
                () -> ledgerBalanceService.recalculateBalance("invoices", "x"));
    }

    @Test
    @DisplayName("Posting an entry stores it and updates the balance")
    void testPostEntry() {
        String customerId = createEntity(LedgerType.CUSTOMER, 1000);

        Map<String, Object> entry = ledgerBalanceService.postEntry(LedgerType.CUSTOMER, customerId,
                LedgerPosting.builder()
                        .debit(new BigDecimal("500"))
                        .entryDate(LocalDate.of(2024, 5, 1))
                        .particulars("Invoice INV-001")
                        .refType("invoice")
                        .refId("inv-1")
                        .build());

        assertEquals(customerId, entry.get("customer_id"));
        assertEquals("2024-05-01", entry.get("entry_date"));
        assertEquals("invoice", entry.get("ref_type"));
        assertAmount("1500", storedBalance(LedgerType.CUSTOMER, customerId));

        ledgerBalanceService.postAmount(LedgerType.CUSTOMER, customerId, new BigDecimal("-200"), "Receipt");

        assertAmount("1300", storedBalance(LedgerType.CUSTOMER, customerId));
        assertEquals(2, recordStore.getByIndex(ErpSchema.CUSTOMER_LEDGER_ENTRIES, "customer_id", customerId).size());
    }

    @Test
    @DisplayName("Posting against a missing entity fails and writes no entry")
    void testPostEntry_MissingEntity() {
        String vendorId = "missing-" + UUID.randomUUID();

        assertThrows(RecordNotFoundException.class, () -> ledgerBalanceService.postAmount(
                LedgerType.VENDOR, vendorId, new BigDecimal("10"), "Nothing"));

        assertTrue(recordStore.getByIndex(ErpSchema.VENDOR_LEDGER_ENTRIES, "vendor_id", vendorId).isEmpty());
    }

    @Test
    @DisplayName("Negative debit or credit amounts are rejected")
    void testPostEntry_NegativeAmount() {
        String customerId = createEntity(LedgerType.CUSTOMER, 0);

        assertThrows(IllegalArgumentException.class, () -> ledgerBalanceService.postEntry(
                LedgerType.CUSTOMER, customerId, LedgerPosting.builder().debit(new BigDecimal("-1")).build()));
    }

    @Test
    @DisplayName("Statement lists entries by date with a running balance")
    void testGetStatement() {
        String customerId = createEntity(LedgerType.CUSTOMER, 1000);
        addEntry(LedgerType.CUSTOMER, customerId, null, 200, "2024-04-03");
        addEntry(LedgerType.CUSTOMER, customerId, 500, null, "2024-04-01");
        addEntry(LedgerType.CUSTOMER, customerId, 50, null, "2024-04-02");

        List<StatementLine> statement = ledgerBalanceService.getStatement(LedgerType.CUSTOMER, customerId);

        assertEquals(3, statement.size());
        assertEquals("2024-04-01", statement.get(0).getEntry().get("entry_date"));
        assertAmount("1500", statement.get(0).getBalance());
        assertAmount("1550", statement.get(1).getBalance());
        assertAmount("200", statement.get(2).getCredit());
        assertAmount("1350", statement.get(2).getBalance());
    }

    @Test
    @DisplayName("Statement of a missing entity fails with NotFound")
    void testGetStatement_MissingEntity() {
        assertThrows(RecordNotFoundException.class,
                () -> ledgerBalanceService.getStatement(LedgerType.LABOUR, "missing-" + UUID.randomUUID()));
    }
}
