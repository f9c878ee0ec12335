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

/** Delivery options for a location. Store pickup only when the location mentions a store. */
@Component
public class FulfillmentOptionsTool implements SalesTool {

    private static final List<String> PICKUP_HINTS = List.of("store", "pickup", "near");

    @Override
    public String getName() {
        return "get_fulfillment_options";
    }

    @Override
    public String getDescription() {
        return "List delivery and pickup options for a delivery location.";
    }

    @Override
    public Set<String> getRequiredParams() {
        return Set.of("location");
    }

    @Override
    public Set<String> getAllowedParams() {
        return getRequiredParams();
    }

    @Override
    public Object execute(Map<String, Object> params) {
        String location = ToolArguments.requireString(params, "location").toLowerCase(Locale.ROOT);

        List<Map<String, Object>> options = new ArrayList<>();
        options.add(option("standard_delivery", "Standard delivery (5-7 business days)", 5.99, 5, null));
        options.add(option("express_delivery", "Express delivery (2-3 business days)", 12.99, 2, null));
        options.add(option("free_standard_delivery", "Free standard delivery (orders over 50)", 0.0, 5, 50.0));

        if (PICKUP_HINTS.stream().anyMatch(location::contains)) {
            options.add(option("store_pickup", "Store pickup (available next day)", 0.0, 1, null));
        }
        return options;
    }

    private static Map<String, Object> option(String type, String description, double cost,
                                              int estimatedDays, Double minOrder) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type);
        m.put("description", description);
        m.put("cost", cost);
        m.put("estimated_days", estimatedDays);
        if (minOrder != null) m.put("min_order", minOrder);
        return m;
    }
}
