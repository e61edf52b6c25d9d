package com.malwa.record_store.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A debit or credit to post against a balance-bearing entity.
 * Missing amounts count as zero; a missing entry date means today.
 */
@Value
@Builder
public class LedgerPosting {
    BigDecimal debit;
    BigDecimal credit;
    LocalDate entryDate;
    String particulars;
    String refType;
    String refId;

    public BigDecimal getDebitOrZero() {
        return debit != null ? debit : BigDecimal.ZERO;
    }

    public BigDecimal getCreditOrZero() {
        return credit != null ? credit : BigDecimal.ZERO;
    }
}
