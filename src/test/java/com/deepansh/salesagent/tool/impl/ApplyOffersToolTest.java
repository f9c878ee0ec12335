package com.deepansh.salesagent.tool.impl;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApplyOffersToolTest {

    private final ApplyOffersTool tool = new ApplyOffersTool();

    @Test
    @SuppressWarnings("unchecked")
    void execute_goldTier_appliesTenPercent() {
        Map<String, Object> result = (Map<String, Object>) tool.execute(Map.of(
                "cart", List.of(Map.of("product_id", "PROD-001", "price", 200, "quantity", 2)),
                "loyalty_tier", "Gold"));

        assertThat(result.get("subtotal")).isEqualTo(400.0);
        assertThat(result.get("total_discount")).isEqualTo(40.0);
        assertThat(result.get("discount_percentage")).isEqualTo(10.0);
        assertThat((List<Map<String, Object>>) result.get("discounts"))
                .extracting(d -> d.get("type"))
                .containsExactly("loyalty_tier");
    }

    @Test
    @SuppressWarnings("unchecked")
    void execute_largeCart_addsBulkDiscount() {
        Map<String, Object> result = (Map<String, Object>) tool.execute(Map.of(
                "cart", List.of(Map.of("price", "1200")),
                "loyalty_tier", "silver"));

        // 5% loyalty (60) + 10% bulk (120)
        assertThat(result.get("total_discount")).isEqualTo(180.0);
        assertThat((List<Map<String, Object>>) result.get("discounts")).hasSize(2);
    }

    @Test
    @SuppressWarnings("unchecked")
    void execute_unknownTier_noDiscount() {
        Map<String, Object> result = (Map<String, Object>) tool.execute(Map.of(
                "cart", List.of(Map.of("price", 100)),
                "loyalty_tier", "diamond"));

        assertThat(result.get("total_discount")).isEqualTo(0.0);
        assertThat((List<?>) result.get("discounts")).isEmpty();
    }

    @Test
    void execute_cartNotAList_throws() {
        assertThatThrownBy(() -> tool.execute(Map.of("cart", "PROD-001", "loyalty_tier", "gold")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cart");
    }
}
