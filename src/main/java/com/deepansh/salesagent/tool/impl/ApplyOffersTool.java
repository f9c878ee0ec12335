package com.deepansh.salesagent.tool.impl;

import com.deepansh.salesagent.tool.SalesTool;
import com.deepansh.salesagent.tool.ToolArguments;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loyalty-tier discount plus a bulk discount on large carts.
 * Cart items are {product_id, price, quantity}; quantity defaults to 1.
 */
@Component
public class ApplyOffersTool implements SalesTool {

    static final Map<String, Double> TIER_DISCOUNTS = Map.of(
            "bronze", 0.0,
            "silver", 0.05,
            "gold", 0.10,
            "platinum", 0.15);

    static final double BULK_THRESHOLD = 1000.0;
    static final double BULK_RATE = 0.10;

    @Override
    public String getName() {
        return "apply_offers";
    }

    @Override
    public String getDescription() {
        return "Work out loyalty and bulk discounts for a cart of {product_id, price, quantity} items.";
    }

    @Override
    public Set<String> getRequiredParams() {
        return Set.of("cart", "loyalty_tier");
    }

    @Override
    public Set<String> getAllowedParams() {
        return getRequiredParams();
    }

    @Override
    public Object execute(Map<String, Object> params) {
        List<Map<String, Object>> cart = ToolArguments.listOfMaps(params, "cart");
        String tier = ToolArguments.requireString(params, "loyalty_tier").toLowerCase(Locale.ROOT);

        double subtotal = subtotal(cart);
        double tierRate = TIER_DISCOUNTS.getOrDefault(tier, 0.0);
        double totalDiscount = subtotal * tierRate;

        List<Map<String, Object>> discounts = new ArrayList<>();
        if (tierRate > 0) {
            discounts.add(discount("loyalty_tier",
                    Character.toUpperCase(tier.charAt(0)) + tier.substring(1) + " member discount",
                    tierRate, subtotal * tierRate));
        }
        if (subtotal > BULK_THRESHOLD) {
            double bulk = subtotal * BULK_RATE;
            discounts.add(discount("bulk", "Bulk order discount (10% off orders over 1000)", BULK_RATE, bulk));
            totalDiscount += bulk;
        }

        Map<String, Object> m = new LinkedHashMap<>();
        m.put("discounts", discounts);
        m.put("total_discount", ToolArguments.round2(totalDiscount));
        m.put("discount_percentage", tierRate * 100);
        m.put("subtotal", ToolArguments.round2(subtotal));
        return m;
    }

    static double subtotal(List<Map<String, Object>> cart) {
        return cart.stream()
                .mapToDouble(item -> ToolArguments.number(item.get("price"), 0)
                        * ToolArguments.number(item.get("quantity"), 1))
                .sum();
    }

    private static Map<String, Object> discount(String type, String description, double rate, double amount) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("type", type);
        d.put("description", description);
        d.put("percentage", rate * 100);
        d.put("amount", ToolArguments.round2(amount));
        return d;
    }
}
