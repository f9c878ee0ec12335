package com.deepansh.salesagent.plan;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class IntentHeuristicsTest {

    @Test
    void detectGender_womensDoesNotReadAsMen() {
        assertThat(IntentHeuristics.detectGender("show me women's clothing"))
                .contains(IntentHeuristics.Gender.FEMALE);
        assertThat(IntentHeuristics.detectGender("shirts for men"))
                .contains(IntentHeuristics.Gender.MALE);
        assertThat(IntentHeuristics.detectGender("show me jackets")).isEmpty();
    }

    @Test
    void detectGender_bothMentioned_femaleWins() {
        assertThat(IntentHeuristics.detectGender("clothes for men and women"))
                .contains(IntentHeuristics.Gender.FEMALE);
    }

    @Test
    void categoryFor_mapsGenderToCategory() {
        assertThat(IntentHeuristics.categoryFor(Optional.of(IntentHeuristics.Gender.FEMALE)))
                .isEqualTo("Women's Fashion");
        assertThat(IntentHeuristics.categoryFor(Optional.of(IntentHeuristics.Gender.MALE)))
                .isEqualTo("Men's Fashion");
        assertThat(IntentHeuristics.categoryFor(Optional.empty())).isEqualTo("Fashion");
    }

    @ParameterizedTest
    @ValueSource(strings = {"hi", "Hello there!", "how are you?", "Thanks a lot", "good morning"})
    void isSmallTalk_greetings(String message) {
        assertThat(IntentHeuristics.isSmallTalk(message)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"hi, show me shirts", "hey is SKU-002 in stock?", "hello, what sizes do you have"})
    void isSmallTalk_shoppingSignalWins(String message) {
        assertThat(IntentHeuristics.isSmallTalk(message)).isFalse();
    }

    @Test
    void mentionsSizeOrStock_phraseAndWords() {
        assertThat(IntentHeuristics.mentionsSizeOrStock("Is it in stock?")).isTrue();
        assertThat(IntentHeuristics.mentionsSizeOrStock("what sizes are available")).isTrue();
        assertThat(IntentHeuristics.mentionsSizeOrStock("what is the price")).isFalse();
        assertThat(IntentHeuristics.mentionsSizeOrStock(null)).isFalse();
    }

    @Test
    void mentionsExplicitIds_caseInsensitive() {
        assertThat(IntentHeuristics.mentionsExplicitIds("check prod-002 please")).isTrue();
        assertThat(IntentHeuristics.mentionsExplicitIds("check the product please")).isFalse();
    }
}
