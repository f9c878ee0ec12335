package com.deepansh.salesagent.llm;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LlmOutputNormalizerTest {

    @Test
    void normalize_proseBeforeJson_dropped() {
        String raw = "Sure! Here's the plan:\n{\"intent\": \"x\", \"steps\": []}";

        assertThat(LlmOutputNormalizer.normalize(raw)).isEqualTo("{\"intent\": \"x\", \"steps\": []}");
    }

    @Test
    void normalize_fencedJson_unwrapped() {
        String raw = "```json\n{\"intent\": \"x\"}\n```";

        assertThat(LlmOutputNormalizer.normalize(raw)).isEqualTo("{\"intent\": \"x\"}");
    }

    @Test
    void normalize_trailingChatter_cutAfterLastBrace() {
        String raw = "{\"intent\": \"x\"}\nLet me know if you need anything else.";

        assertThat(LlmOutputNormalizer.normalize(raw)).isEqualTo("{\"intent\": \"x\"}");
    }

    @Test
    void normalize_nullAndGarbage_neverThrow() {
        assertThat(LlmOutputNormalizer.normalize(null)).isEmpty();
        assertThat(LlmOutputNormalizer.normalize("  no json here  ")).isEqualTo("no json here");
        assertThat(LlmOutputNormalizer.normalize("```")).isEmpty();
    }
}
