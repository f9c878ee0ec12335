package com.deepansh.salesagent.store;

import java.util.LinkedHashMap;
import java.util.Map;

public record Product(String productId, String name, String category, double basePrice) {

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("product_id", productId);
        m.put("name", name);
        m.put("category", category);
        m.put("base_price", basePrice);
        return m;
    }
}
