package com.malwa.record_store.ledger;

/**
 * Field names shared by balance-bearing entities and their ledger entries.
 */
final class LedgerFields {

    static final String OPENING_BALANCE = "opening_balance";
    static final String CURRENT_BALANCE = "current_balance";

    static final String DEBIT = "debit";
    static final String CREDIT = "credit";
    static final String ENTRY_DATE = "entry_date";
    static final String PARTICULARS = "particulars";
    static final String REF_TYPE = "ref_type";
    static final String REF_ID = "ref_id";

    private LedgerFields() {
    }
}
