package com.malwa.record_store.inventory;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
public class StockHistoryLine {
    Map<String, Object> movement;
    MovementType type;
    BigDecimal quantity;
    BigDecimal runningStock;
}
