package com.malwa.record_store.inventory;

import com.malwa.record_store.schema.ErpSchema;
import com.malwa.record_store.store.RecordFields;
import com.malwa.record_store.store.RecordStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class InventoryServiceTest {

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url",
                () -> "jdbc:h2:mem:inventory_service_test;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    }

    @Autowired
    private InventoryService inventoryService;

    @Autowired
    private RecordStore recordStore;

    private String createItem(int stock) {
        String code = "ITM-" + UUID.randomUUID();
        return (String) recordStore.insert(ErpSchema.INVENTORY_ITEMS,
                Map.of("code", code, "item_name", "Oil filter", "current_stock", stock)).get("id");
    }

    private BigDecimal stockOf(String itemId) {
        return RecordFields.decimal(recordStore.getById(ErpSchema.INVENTORY_ITEMS, itemId).orElseThrow(), "current_stock");
    }

    @Test
    @DisplayName("IN adds, OUT subtracts and ADJUSTMENT sets the stock level")
    void testUpdateStock() {
        String itemId = createItem(10);

        assertEquals(0, new BigDecimal("15").compareTo(
                inventoryService.updateStock(itemId, MovementType.IN, new BigDecimal("5"), "purchase").orElseThrow()));
        assertEquals(0, new BigDecimal("12").compareTo(
                inventoryService.updateStock(itemId, MovementType.OUT, new BigDecimal("3"), "jobsheet").orElseThrow()));
        assertEquals(0, new BigDecimal("40").compareTo(
                inventoryService.updateStock(itemId, MovementType.ADJUSTMENT, new BigDecimal("40"), "count").orElseThrow()));

        assertEquals(0, new BigDecimal("40").compareTo(stockOf(itemId)));
    }

    @Test
    @DisplayName("Each stock update records a movement")
    void testUpdateStock_RecordsMovement() {
        String itemId = createItem(2);

        inventoryService.updateStock(itemId, MovementType.OUT, new BigDecimal("2"), "challan");

        List<Map<String, Object>> movements = recordStore.getByIndex(ErpSchema.STOCK_MOVEMENTS, "item_id", itemId);
        assertEquals(1, movements.size());
        Map<String, Object> movement = movements.get(0);
        assertEquals("out", movement.get("type"));
        assertEquals("challan", movement.get("reason"));
        assertEquals(0, BigDecimal.ZERO.compareTo(RecordFields.decimal(movement, "stock_after")));
        assertEquals(0, new BigDecimal("2").compareTo(RecordFields.decimal(movement, "stock_before")));
    }

    @Test
    @DisplayName("Updating a missing item is a no-op")
    void testUpdateStock_MissingItem() {
        String itemId = "missing-" + UUID.randomUUID();

        assertTrue(inventoryService.updateStock(itemId, MovementType.IN, BigDecimal.ONE, "purchase").isEmpty());
        assertTrue(recordStore.getByIndex(ErpSchema.STOCK_MOVEMENTS, "item_id", itemId).isEmpty());
        assertTrue(inventoryService.getStockHistory(itemId).isEmpty());
    }

    @Test
    @DisplayName("Negative quantities are rejected")
    void testUpdateStock_NegativeQuantity() {
        String itemId = createItem(1);

        assertThrows(IllegalArgumentException.class,
                () -> inventoryService.updateStock(itemId, MovementType.IN, new BigDecimal("-1"), "oops"));
        assertEquals(0, BigDecimal.ONE.compareTo(stockOf(itemId)));
    }

    @Test
    @DisplayName("Stock history replays movements in order with a running level")
    void testGetStockHistory() {
        String itemId = createItem(0);
        inventoryService.updateStock(itemId, MovementType.IN, new BigDecimal("10"), "purchase");
        inventoryService.updateStock(itemId, MovementType.OUT, new BigDecimal("4"), "jobsheet");
        inventoryService.updateStock(itemId, MovementType.IN, new BigDecimal("1"), "return");

        List<StockHistoryLine> history = inventoryService.getStockHistory(itemId);

        assertEquals(3, history.size());
        assertEquals(MovementType.IN, history.get(0).getType());
        assertEquals(0, new BigDecimal("10").compareTo(history.get(0).getRunningStock()));
        assertEquals(0, new BigDecimal("6").compareTo(history.get(1).getRunningStock()));
        assertEquals(0, new BigDecimal("7").compareTo(history.get(2).getRunningStock()));
        assertEquals(0, stockOf(itemId).compareTo(history.get(2).getRunningStock()));
    }
}
