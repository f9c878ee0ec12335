package com.deepansh.salesagent.tool.impl;

import com.deepansh.salesagent.store.InventoryRecord;
import com.deepansh.salesagent.store.ProductStore;
import com.deepansh.salesagent.tool.SalesTool;
import com.deepansh.salesagent.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stock lookup by SKU or product id, optionally narrowed to one size.
 *
 * Nothing is strictly required at plan level: the resolver fills product_id
 * from earlier recommendations when the planner could not name the product.
 * A call that still has neither sku nor product_id fails here.
 *
 * Result always carries available / quantity / location; without a size it
 * also lists every size row.
 */
@Component
@RequiredArgsConstructor
public class CheckInventoryTool implements SalesTool {

    private final ProductStore productStore;

    @Override
    public String getName() {
        return "check_inventory";
    }

    @Override
    public String getDescription() {
        return "Check stock for a product (by sku or product_id), per size or for all sizes.";
    }

    @Override
    public Set<String> getRequiredParams() {
        return Set.of();
    }

    @Override
    public Set<String> getAllowedParams() {
        return Set.of("sku", "size", "product_id");
    }

    @Override
    public Object execute(Map<String, Object> params) {
        String sku = ToolArguments.string(params, "sku");
        String productId = ToolArguments.string(params, "product_id");
        String size = SizeLabels.normalize(ToolArguments.string(params, "size"));

        if (sku == null && productId == null) {
            throw new IllegalArgumentException("check_inventory needs a sku or a product_id");
        }

        if (sku != null && size != null) {
            return productStore.findInventory(sku, size)
                    .map(this::singleSize)
                    .orElseGet(() -> notFound(sku, productId, size));
        }

        List<InventoryRecord> rows = sku != null
                ? productStore.findInventoryBySku(sku)
                : productStore.findInventoryByProduct(productId);
        if (size != null) {
            rows = rows.stream().filter(r -> size.equalsIgnoreCase(r.size())).toList();
        }
        if (rows.isEmpty()) {
            return notFound(sku, productId, size);
        }
        return allSizes(rows);
    }

    private Map<String, Object> singleSize(InventoryRecord r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("available", r.quantity() > 0);
        m.put("quantity", r.quantity());
        m.put("sku", r.sku());
        m.put("size", r.size());
        m.put("product_id", r.productId());
        m.put("location", r.location());
        m.put("product_name", r.productName());
        m.put("category", r.category());
        return m;
    }

    private Map<String, Object> allSizes(List<InventoryRecord> rows) {
        List<Map<String, Object>> sizes = new ArrayList<>();
        int total = 0;
        String location = null;
        for (InventoryRecord r : rows) {
            Map<String, Object> s = new LinkedHashMap<>();
            s.put("size", r.size());
            s.put("quantity", r.quantity());
            s.put("sku", r.sku());
            s.put("location", r.location());
            sizes.add(s);

            total += r.quantity();
            if (location == null && r.quantity() > 0) location = r.location();
        }

        InventoryRecord first = rows.get(0);
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("available", total > 0);
        m.put("quantity", total);
        m.put("product_id", first.productId());
        m.put("product_name", first.productName());
        m.put("location", location != null ? location : first.location());
        m.put("sizes", sizes);
        m.put("available_sizes", sizes.stream()
                .filter(s -> ((Integer) s.get("quantity")) > 0)
                .map(s -> s.get("size"))
                .toList());
        return m;
    }

    private Map<String, Object> notFound(String sku, String productId, String size) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("available", false);
        m.put("quantity", 0);
        m.put("sku", sku);
        m.put("product_id", productId);
        m.put("size", size);
        m.put("location", null);
        return m;
    }
}
