package com.malwa.record_store.inventory;

import com.malwa.record_store.observability.StoreMetrics;
import com.malwa.record_store.schema.ErpSchema;
import com.malwa.record_store.store.RecordFields;
import com.malwa.record_store.store.ScopedCollection;
import com.malwa.record_store.store.TransactionCoordinator;
import com.malwa.record_store.store.TxMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Stock level changes on inventory items.
 *
 * Each change updates {@code current_stock} on the item and appends a movement record
 * in the same transaction, so the item and its movement history never disagree.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InventoryService {

    static final String CURRENT_STOCK = "current_stock";
    static final String ITEM_ID = "item_id";
    static final String DATE = "date";
    static final String TYPE = "type";
    static final String QUANTITY = "quantity";
    static final String REASON = "reason";
    static final String STOCK_BEFORE = "stock_before";
    static final String STOCK_AFTER = "stock_after";

    private static final List<String> SCOPE = List.of(ErpSchema.INVENTORY_ITEMS, ErpSchema.STOCK_MOVEMENTS);

    private static final Comparator<String> NULLS_LAST = Comparator.nullsLast(Comparator.<String>naturalOrder());

    private static final Comparator<Map<String, Object>> HISTORY_ORDER =
        Comparator.comparing((Map<String, Object> movement) -> RecordFields.string(movement, DATE), NULLS_LAST)
            .thenComparing(movement -> RecordFields.instant(movement, RecordFields.CREATED_AT),
                Comparator.nullsLast(Comparator.<Instant>naturalOrder()));

    private final TransactionCoordinator coordinator;
    private final StoreMetrics metrics;
    private final Clock clock;

    /**
     * Applies a stock movement to an item and records it.
     *
     * @param quantity units moved, or the new level for {@link MovementType#ADJUSTMENT}
     * @return the item's new stock level, or empty if the item does not exist
     */
    public Optional<BigDecimal> updateStock(String itemId, MovementType type, BigDecimal quantity, String reason) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(quantity, "quantity");
        if (quantity.signum() < 0) {
            throw new IllegalArgumentException("Quantity must not be negative: " + quantity);
        }

        Optional<BigDecimal> result = coordinator.runTransaction(SCOPE, TxMode.READ_WRITE, scope -> {
            ScopedCollection items = scope.collection(ErpSchema.INVENTORY_ITEMS);
            Optional<Map<String, Object>> item = itemId != null ? items.getForUpdate(itemId) : Optional.empty();
            if (item.isEmpty()) {
                log.debug("Stock update skipped, item not found: itemId={}", itemId);
                return Optional.<BigDecimal>empty();
            }

            BigDecimal before = RecordFields.decimal(item.get(), CURRENT_STOCK);
            BigDecimal after = type.apply(before, quantity);
            items.update(itemId, Map.of(CURRENT_STOCK, after));

            Map<String, Object> movement = new LinkedHashMap<>();
            movement.put(ITEM_ID, itemId);
            movement.put(DATE, LocalDate.now(clock).toString());
            movement.put(TYPE, type.storedName());
            movement.put(QUANTITY, quantity);
            movement.put(REASON, reason);
            movement.put(STOCK_BEFORE, before);
            movement.put(STOCK_AFTER, after);
            scope.collection(ErpSchema.STOCK_MOVEMENTS).add(movement);

            return Optional.of(after);
        });

        result.ifPresent(stock -> {
            metrics.recordStockMovement(type.storedName());
            log.info("Stock updated: itemId={}, type={}, quantity={}, stock={}", itemId, type, quantity, stock);
        });
        return result;
    }

    /**
     * Returns the item's movements in date order, each with the stock level obtained by
     * replaying every movement up to and including it from zero.
     */
    public List<StockHistoryLine> getStockHistory(String itemId) {
        Objects.requireNonNull(itemId, "itemId");
        List<Map<String, Object>> movements = new ArrayList<>(coordinator.runTransaction(
            List.of(ErpSchema.STOCK_MOVEMENTS), TxMode.READ_ONLY,
            scope -> scope.collection(ErpSchema.STOCK_MOVEMENTS).getByIndex(ITEM_ID, itemId)));
        movements.sort(HISTORY_ORDER);

        BigDecimal running = BigDecimal.ZERO;
        List<StockHistoryLine> lines = new ArrayList<>(movements.size());
        for (Map<String, Object> movement : movements) {
            MovementType type = MovementType.fromStoredName(RecordFields.string(movement, TYPE));
            BigDecimal quantity = RecordFields.decimal(movement, QUANTITY);
            running = type.apply(running, quantity);
            lines.add(new StockHistoryLine(movement, type, quantity, running));
        }
        return lines;
    }
}
