package com.deepansh.salesagent.plan;

import com.deepansh.salesagent.llm.CompletionClient;
import com.deepansh.salesagent.llm.PromptTemplates;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlanRepairServiceTest {

    private CompletionClient completionClient;
    private PlanRepairService service;

    @BeforeEach
    void setUp() {
        completionClient = mock(CompletionClient.class);
        service = new PlanRepairService(completionClient, new ObjectMapper());
    }

    @Test
    void repair_fencedAnswer_decodedAndUnderscoreKeysDropped() {
        when(completionClient.complete(anyString(), eq(PromptTemplates.REPAIR_SYSTEM_PROMPT))).thenReturn("""
                Here is the fixed plan:
                ```json
                {"intent": "check shirt stock", "steps": [{"action": "check_inventory", "params": {"sku": "SKU-002"}}],
                 "response_style": "friendly", "_parse_error": "stale"}
                ```""");

        Map<String, Object> repaired = service.repair(
                invalid("check shirt stock", "check_inventory"), "{broken");

        assertThat(repaired).containsKeys("intent", "steps", "response_style").doesNotContainKey("_parse_error");
        verify(completionClient).complete(contains("check_inventory"), eq(PromptTemplates.REPAIR_SYSTEM_PROMPT));
    }

    @Test
    void repair_droppedStep_isSemanticViolation() {
        Map<String, Object> original = new LinkedHashMap<>();
        original.put("intent", "recommend then check stock");
        original.put("steps", List.of(
                Map.of("action", "recommend_products"),
                Map.of("action", "check_inventory"),
                Map.of("action", "check_inventory")));
        when(completionClient.complete(anyString(), anyString())).thenReturn("""
                {"intent": "recommend then check stock", "steps": [
                  {"action": "recommend_products", "params": {}},
                  {"action": "check_inventory", "params": {}}], "response_style": "friendly"}""");

        assertThatThrownBy(() -> service.repair(original, "{...}"))
                .isInstanceOf(SemanticViolationException.class)
                .hasMessage("Step count changed from 3 to 2");
    }

    @Test
    void repair_swappedAction_isSemanticViolation() {
        when(completionClient.complete(anyString(), anyString())).thenReturn("""
                {"intent": "check shirt stock", "steps": [{"action": "recommend_products", "params": {}}]}""");

        assertThatThrownBy(() -> service.repair(invalid("check shirt stock", "check_inventory"), "{...}"))
                .isInstanceOf(SemanticViolationException.class)
                .hasMessageStartingWith("Actions changed");
    }

    @Test
    void repair_unrelatedLongIntent_isSemanticViolation() {
        when(completionClient.complete(anyString(), anyString())).thenReturn("""
                {"intent": "greeting", "steps": [{"action": "check_inventory", "params": {}}]}""");

        assertThatThrownBy(() -> service.repair(invalid("check shirt stock", "check_inventory"), "{...}"))
                .isInstanceOf(SemanticViolationException.class)
                .hasMessageContaining("Intent changed");
    }

    @Test
    void repair_shortIntentMayBeReworded() {
        when(completionClient.complete(anyString(), anyString())).thenReturn("""
                {"intent": "inventory lookup", "steps": [{"action": "check_inventory", "params": {}}]}""");

        Map<String, Object> repaired = service.repair(invalid("stock check", "check_inventory"), "{...}");

        assertThat(repaired).containsEntry("intent", "inventory lookup");
    }

    @Test
    void repair_nonObjectAnswer_throwsRepairException() {
        when(completionClient.complete(anyString(), anyString())).thenReturn("I cannot help with that.");

        assertThatThrownBy(() -> service.repair(invalid("stock check", "check_inventory"), "{...}"))
                .isInstanceOf(PlanRepairException.class);
    }

    private static Map<String, Object> invalid(String intent, String action) {
        Map<String, Object> plan = new LinkedHashMap<>();
        plan.put("intent", intent);
        plan.put("steps", List.of(Map.of("action", action)));
        return plan;
    }
}
