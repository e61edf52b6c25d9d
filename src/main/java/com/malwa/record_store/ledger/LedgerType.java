package com.malwa.record_store.ledger;

import com.malwa.record_store.schema.ErpSchema;

import java.util.Arrays;

/**
 * Balance-bearing entity types and where their ledger entries live.
 */
public enum LedgerType {
    CUSTOMER(ErpSchema.CUSTOMERS, ErpSchema.CUSTOMER_LEDGER_ENTRIES, "customer_id"),
    VENDOR(ErpSchema.VENDORS, ErpSchema.VENDOR_LEDGER_ENTRIES, "vendor_id"),
    LABOUR(ErpSchema.LABOUR, ErpSchema.LABOUR_LEDGER_ENTRIES, "labour_id"),
    SUPPLIER(ErpSchema.SUPPLIERS, ErpSchema.SUPPLIER_LEDGER_ENTRIES, "supplier_id");

    private final String entityCollection;
    private final String ledgerCollection;
    private final String ownerField;

    LedgerType(String entityCollection, String ledgerCollection, String ownerField) {
        this.entityCollection = entityCollection;
        this.ledgerCollection = ledgerCollection;
        this.ownerField = ownerField;
    }

    public String getEntityCollection() {
        return entityCollection;
    }

    public String getLedgerCollection() {
        return ledgerCollection;
    }

    /**
     * Field on each ledger entry holding the owning entity's id; also the name of its index.
     */
    public String getOwnerField() {
        return ownerField;
    }

    public static LedgerType fromEntityCollection(String collection) {
        return Arrays.stream(values())
            .filter(type -> type.entityCollection.equals(collection))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Collection has no ledger: " + collection));
    }
}
