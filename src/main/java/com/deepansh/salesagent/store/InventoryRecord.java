package com.deepansh.salesagent.store;

/** One inventory row joined with its product's name and category (both may be null). */
public record InventoryRecord(
        String sku,
        String productId,
        String size,
        int quantity,
        String location,
        String productName,
        String category) {
}
