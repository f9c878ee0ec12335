package com.deepansh.salesagent.llm;

import com.deepansh.salesagent.config.EngineProperties;
import com.deepansh.salesagent.tool.ToolCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PlanProposerTest {

    private CompletionClient completionClient;
    private PlanProposer proposer;

    @BeforeEach
    void setUp() {
        completionClient = mock(CompletionClient.class);
        ToolCatalog catalog = new ToolCatalog(List.of());
        proposer = new PlanProposer(completionClient, catalog, new ObjectMapper(), new EngineProperties());
    }

    @Test
    void propose_validJson_decodedAsMap() {
        when(completionClient.complete(anyString(), anyString()))
                .thenReturn("```json\n{\"intent\": \"greeting\", \"steps\": [], \"response_style\": \"friendly\"}\n```");

        PlanProposer.Proposal proposal = proposer.propose("hi", "s1", "001", Map.of());

        assertThat(proposal.rawPlan()).asInstanceOf(MAP).containsEntry("intent", "greeting");
        assertThat(proposal.rawText()).startsWith("```json");
    }

    @Test
    void propose_undecodable_returnsParseErrorPlaceholder() {
        when(completionClient.complete(anyString(), anyString())).thenReturn("{\"intent\": \"oops\", ");

        PlanProposer.Proposal proposal = proposer.propose("hi", "s1", "001", Map.of());

        Map<?, ?> plan = (Map<?, ?>) proposal.rawPlan();
        assertThat(plan.get("intent")).isEqualTo(PlanProposer.PARSE_ERROR_INTENT);
        assertThat(plan.get("_parse_error")).isNotNull();
        assertThat(plan.get("_raw_response")).isEqualTo("{\"intent\": \"oops\", ");
    }

    @Test
    void buildUserPrompt_forwardsPersonalizationAndHistory() {
        Map<String, Object> context = Map.of(
                "last_intent", "recommend",
                "internal_cache", "never sent",
                "personalization", Map.of("gender", "female", "preferred_size", "M"),
                "message_history", List.of(Map.of("user", "show dresses", "intent", "recommend", "response", "Here...")));

        String prompt = proposer.buildUserPrompt("in medium?", "s1", "001", context);

        assertThat(prompt)
                .contains("\"user_gender\" : \"female\"")
                .contains("\"user_preferred_size\" : \"M\"")
                .contains("\"last_intent\" : \"recommend\"")
                .contains("show dresses")
                .doesNotContain("internal_cache");
    }

    @Test
    void compactHistory_keepsLastTurnsAndTruncates() {
        List<Object> history = List.of(
                Map.of("user", "first", "response", "r1"),
                "junk",
                Map.of("user", "a very long message", "response", "r3", "intent", "x"));

        List<Map<String, Object>> compacted = PlanProposer.compactHistory(history, 2, 6);

        assertThat(compacted).hasSize(1);
        assertThat(compacted.get(0)).containsEntry("user", "a very").containsEntry("intent", "x");
    }
}
