package com.deepansh.salesagent.tool.impl;

import com.deepansh.salesagent.tool.SalesTool;
import com.deepansh.salesagent.tool.ToolArguments;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Final amount: subtotal minus apply_offers' total_discount, plus 10% tax. */
@Component
public class CalculatePaymentTool implements SalesTool {

    static final double TAX_RATE = 0.10;
    static final String CURRENCY = "INR";

    @Override
    public String getName() {
        return "calculate_payment";
    }

    @Override
    public String getDescription() {
        return "Compute the payable amount for a cart given the discounts returned by apply_offers.";
    }

    @Override
    public Set<String> getRequiredParams() {
        return Set.of("cart", "discounts");
    }

    @Override
    public Set<String> getAllowedParams() {
        return getRequiredParams();
    }

    @Override
    public Object execute(Map<String, Object> params) {
        List<Map<String, Object>> cart = ToolArguments.listOfMaps(params, "cart");
        Map<String, Object> discounts = ToolArguments.map(params, "discounts");

        double subtotal = ApplyOffersTool.subtotal(cart);
        double totalDiscount = ToolArguments.number(discounts.get("total_discount"), 0);
        if (totalDiscount < 0 || totalDiscount > subtotal) {
            throw new IllegalArgumentException(
                    "total_discount " + totalDiscount + " is outside 0.." + subtotal);
        }

        double afterDiscount = subtotal - totalDiscount;
        double tax = afterDiscount * TAX_RATE;

        Map<String, Object> m = new LinkedHashMap<>();
        m.put("subtotal", ToolArguments.round2(subtotal));
        m.put("total_discount", ToolArguments.round2(totalDiscount));
        m.put("amount_after_discount", ToolArguments.round2(afterDiscount));
        m.put("tax_rate", TAX_RATE * 100);
        m.put("tax", ToolArguments.round2(tax));
        m.put("final_amount", ToolArguments.round2(afterDiscount + tax));
        m.put("currency", CURRENCY);
        return m;
    }
}
