package com.nearbyproducts.dedup;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TitleSimilarityTest {

    private final TitleSimilarity similarity = new TitleSimilarity();

    @Test
    void shouldTreatCaseAndWhitespaceVariantsAsSimilar() {
        assertThat(similarity.isSimilar("Sunset Over Paris", "sunset over paris ")).isTrue();
    }

    @Test
    void shouldMatchReorderedTokens() {
        assertThat(similarity.isSimilar("Sunset Over Paris", "Paris Sunset Over")).isTrue();
    }

    @Test
    void shouldIgnoreShortTokensAndAcceptThresholdBoundary() {
        // [day, rome] vs [day, rome, night] -> 2*2/5 = 0.8
        assertThat(similarity.score("A Day in Rome", "A Day in Rome at Night")).isEqualTo(0.8);
        assertThat(similarity.isSimilar("A Day in Rome", "A Day in Rome at Night")).isTrue();
    }

    @Test
    void shouldRejectDifferentTitles() {
        assertThat(similarity.isSimilar("Sunset Over Paris", "Morning In Berlin")).isFalse();
    }

    @Test
    void shouldNeverMatchEmptyTitles() {
        assertThat(similarity.isSimilar("", "")).isFalse();
        assertThat(similarity.isSimilar(null, null)).isFalse();
        assertThat(similarity.isSimilar("   ", "   ")).isFalse();
        assertThat(similarity.isSimilar("Paris", null)).isFalse();
    }

    @Test
    void shouldMatchIdenticalTitlesMadeOfShortTokens() {
        assertThat(similarity.isSimilar("Up", "up")).isTrue();
    }

    @Test
    void shouldHonourConfiguredThreshold() {
        TitleSimilarity lenient = new TitleSimilarity(0.5, TitleSimilarity.DEFAULT_MIN_TOKEN_LENGTH);

        assertThat(similarity.isSimilar("Old Harbour Lights", "Old Harbour Morning")).isFalse();
        assertThat(lenient.isSimilar("Old Harbour Lights", "Old Harbour Morning")).isTrue();
    }
}
