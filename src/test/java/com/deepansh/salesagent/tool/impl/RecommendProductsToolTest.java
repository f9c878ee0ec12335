package com.deepansh.salesagent.tool.impl;

import com.deepansh.salesagent.store.Product;
import com.deepansh.salesagent.store.ProductStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecommendProductsToolTest {

    private static final Product DRESS = new Product("PROD-001", "Women's Dress", "Women's Fashion", 1499.0);
    private static final Product SHIRT = new Product("PROD-002", "Men's Shirt", "Men's Fashion", 899.0);

    private ProductStore productStore;
    private RecommendProductsTool tool;

    @BeforeEach
    void setUp() {
        productStore = mock(ProductStore.class);
        tool = new RecommendProductsTool(productStore);
    }

    @Test
    @SuppressWarnings("unchecked")
    void execute_noExactCategory_fallsBackToContains() {
        when(productStore.findByCategory(eq("Fashion"), eq(true), any(), any(), anyInt())).thenReturn(List.of());
        when(productStore.findByCategory(eq("Fashion"), eq(false), any(), any(), anyInt()))
                .thenReturn(List.of(SHIRT, DRESS));

        List<Map<String, Object>> result = (List<Map<String, Object>>) tool.execute(
                Map.of("category", "Fashion", "gender", "female"));

        assertThat(result).extracting(p -> p.get("product_id")).containsExactly("PROD-001");
    }

    @Test
    void execute_priceRange_passedToStore() {
        when(productStore.findByCategory(eq("Men's Fashion"), eq(true), any(), any(), anyInt()))
                .thenReturn(List.of(SHIRT));

        tool.execute(Map.of("category", "Men's Fashion", "price_range", "500-1000"));

        verify(productStore).findByCategory("Men's Fashion", true, 500.0, 1000.0, RecommendProductsTool.LIMIT);
    }

    @Test
    void matchesGender_womensNeverMatchesMale() {
        assertThat(RecommendProductsTool.matchesGender(DRESS, "male")).isFalse();
        assertThat(RecommendProductsTool.matchesGender(SHIRT, "male")).isTrue();
        assertThat(RecommendProductsTool.matchesGender(SHIRT, null)).isTrue();
    }

    @Test
    void priceRange_anyOrMalformed_isUnbounded() {
        assertThat(RecommendProductsTool.PriceRange.parse("any").min()).isNull();
        assertThat(RecommendProductsTool.PriceRange.parse("cheap-ish").max()).isNull();
        assertThat(RecommendProductsTool.PriceRange.parse("100 - 200").max()).isEqualTo(200.0);
    }
}
