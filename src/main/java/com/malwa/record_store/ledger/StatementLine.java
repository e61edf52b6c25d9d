package com.malwa.record_store.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * One ledger entry with the balance after it was applied.
 */
@Value
public class StatementLine {
    Map<String, Object> entry;
    BigDecimal debit;
    BigDecimal credit;
    BigDecimal balance;
}
