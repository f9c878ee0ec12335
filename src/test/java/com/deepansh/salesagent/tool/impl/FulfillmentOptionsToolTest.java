package com.deepansh.salesagent.tool.impl;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FulfillmentOptionsToolTest {

    private final FulfillmentOptionsTool tool = new FulfillmentOptionsTool();

    @Test
    @SuppressWarnings("unchecked")
    void execute_homeAddress_deliveryOnly() {
        List<Map<String, Object>> options = (List<Map<String, Object>>) tool.execute(Map.of("location", "Bangalore"));

        assertThat(options).extracting(o -> o.get("type"))
                .containsExactly("standard_delivery", "express_delivery", "free_standard_delivery");
    }

    @Test
    @SuppressWarnings("unchecked")
    void execute_storeLocation_addsPickup() {
        List<Map<String, Object>> options = (List<Map<String, Object>>) tool.execute(Map.of("location", "MG Road Store"));

        assertThat(options).extracting(o -> o.get("type")).contains("store_pickup");
    }

    @Test
    void execute_blankLocation_throws() {
        assertThatThrownBy(() -> tool.execute(Map.of("location", "  ")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing required parameter: location");
    }
}
