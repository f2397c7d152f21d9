package com.deepansh.policyradar.memory;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HashingEmbeddingProviderTest {

    private final HashingEmbeddingProvider provider = new HashingEmbeddingProvider(256);

    @Test
    void embed_isDeterministicAndUnitLength() {
        List<float[]> vectors = provider.embed(List.of("Clean Water Act rule", "Clean Water Act rule"));

        assertThat(vectors.get(0)).hasSize(256).containsExactly(vectors.get(1));
        double norm = 0;
        for (float v : vectors.get(0)) norm += v * v;
        assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-5));
    }

    @Test
    void embed_sharedVocabularyScoresHigherThanUnrelatedText() {
        List<float[]> v = provider.embed(List.of(
                "federal grant awards to states",
                "grant awards for states from federal agencies",
                "supreme court opinion on patents"));

        assertThat(VectorMath.cosineSimilarity(v.get(0), v.get(1)))
                .isGreaterThan(VectorMath.cosineSimilarity(v.get(0), v.get(2)));
    }

    @Test
    void embed_emptyText_returnsZeroVector() {
        assertThat(provider.embed(List.of("")).get(0)).containsOnly(0f);
    }
}
