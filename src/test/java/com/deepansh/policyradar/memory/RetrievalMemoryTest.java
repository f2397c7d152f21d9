package com.deepansh.policyradar.memory;

import com.deepansh.policyradar.config.RadarProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RetrievalMemoryTest {

    private static final String SESSION = "session-alpha";

    private RadarProperties properties;
    private InMemoryVectorIndex index;
    private EmbeddingService embeddingService;
    private RetrievalMemory memory;
    private EmbeddingConfig config;

    @BeforeEach
    void setUp() {
        properties = new RadarProperties();
        index = new InMemoryVectorIndex();
        embeddingService = embeddingService(properties);
        memory = new RetrievalMemory(index, embeddingService, properties);
        config = embeddingService.defaultConfig();
    }

    private static EmbeddingService embeddingService(RadarProperties props) {
        return new EmbeddingService(props, RestClient.builder(), Retry.ofDefaults("test"), (StringRedisTemplate) null, new ObjectMapper());
    }

    private static String document() {
        String filler = "lorem ipsum dolor sit amet consectetur ".repeat(80).substring(0, 2199) + " ";
        String tail = "sovereign wealth fund appropriations oversight ".repeat(10).substring(0, 300);
        return filler + tail;
    }

    @Test
    void ingest_sameContentTwice_skipsSecondTime() {
        IngestResult first = memory.ingest(SESSION, "doc-1", document(), null, config);
        IngestResult second = memory.ingest(SESSION, "doc-1", document(), null, config);

        assertThat(first.status()).isEqualTo(IngestResult.INDEXED);
        assertThat(first.chunks()).isEqualTo(3);
        assertThat(first.namespace()).isEqualTo(config.namespace());
        assertThat(second.status()).isEqualTo(IngestResult.SKIPPED);
        assertThat(second.reason()).isEqualTo("already_indexed");
    }

    @Test
    void ingest_changedContent_replacesPreviousChunks() {
        memory.ingest(SESSION, "doc-1", document(), null, config);
        IngestResult updated = memory.ingest(SESSION, "doc-1", "a much shorter revision of the notice", null, config);

        assertThat(updated.status()).isEqualTo(IngestResult.INDEXED);
        assertThat(memory.query(SESSION, "revision notice", 10, config))
                .singleElement()
                .satisfies(m -> assertThat(m.text()).isEqualTo("a much shorter revision of the notice"));
    }

    @Test
    void ingest_missingSessionOrText_isSkipped() {
        assertThat(memory.ingest(null, "doc", "text", null, config).reason()).isEqualTo("missing_session_or_text");
        assertThat(memory.ingest(SESSION, "doc", "   \n\t ", null, config).status()).isEqualTo(IngestResult.SKIPPED);
    }

    @Test
    void query_ranksChunkWithQueryTermsFirst() {
        memory.ingest(SESSION, "doc-1", document(),
                new RetrievalMemory.DocumentMetadata("https://example.gov/a", "web_page", null), config);

        List<MemoryMatch> matches = memory.query(SESSION, "sovereign wealth fund appropriations", 3, config);

        assertThat(matches).hasSize(3);
        assertThat(matches.get(0).chunkIndex()).isEqualTo(2);
        assertThat(matches.get(0).sourceUrl()).isEqualTo("https://example.gov/a");
        assertThat(matches.get(0).score()).isGreaterThan(matches.get(2).score());
        assertThat(matches.get(0).id()).startsWith(RetrievalMemory.chunkIdPrefix(SESSION, "doc-1"));
    }

    @Test
    void query_neverReturnsOtherSessionsChunks() {
        memory.ingest(SESSION, "doc-1", document(), null, config);
        memory.ingest("session-beta", "doc-2", "beta appropriations text", null, config);

        assertThat(memory.query(SESSION, "appropriations", 10, config))
                .extracting(MemoryMatch::docKey)
                .containsOnly("doc-1");
    }

    @Test
    void query_differentModel_usesSeparateNamespace() {
        memory.ingest(SESSION, "doc-1", document(), null, config);
        EmbeddingConfig other = new EmbeddingConfig("local", "hashing-128", null, null);

        assertThat(other.namespace()).isNotEqualTo(config.namespace());
        assertThat(memory.query(SESSION, "appropriations", 5, other)).isEmpty();

        memory.ingest(SESSION, "doc-1", document(), null, other);
        assertThat(memory.query(SESSION, "appropriations", 5, other)).hasSize(3);
        assertThat(memory.query(SESSION, "appropriations", 5, config)).hasSize(3);
    }

    @Test
    void ingest_dimensionChangeUnderSameModel_recreatesNamespace() {
        EmbeddingConfig fixedModel = new EmbeddingConfig("local", "local-hash", null, null);
        memory.ingest(SESSION, "doc-1", document(), null, fixedModel);
        assertThat(index.dimension(fixedModel.namespace())).isEqualTo(384);

        RadarProperties resized = new RadarProperties();
        resized.getEmbedding().setLocalDimensions(64);
        RetrievalMemory resizedMemory = new RetrievalMemory(index, embeddingService(resized), resized);

        IngestResult result = resizedMemory.ingest(SESSION, "doc-2", "new document after a model upgrade", null, fixedModel);

        assertThat(result.status()).isEqualTo(IngestResult.INDEXED);
        assertThat(index.dimension(fixedModel.namespace())).isEqualTo(64);
        assertThat(resizedMemory.query(SESSION, "model upgrade", 10, fixedModel))
                .extracting(MemoryMatch::docKey)
                .containsOnly("doc-2");
    }

    @Test
    void deleteSession_removesOnlyThatSession() {
        memory.ingest(SESSION, "doc-1", document(), null, config);
        memory.ingest("session-beta", "doc-2", "beta text", null, config);

        assertThat(memory.deleteSession(SESSION)).isEqualTo(3);
        assertThat(memory.query(SESSION, "appropriations", 5, config)).isEmpty();
        assertThat(memory.query("session-beta", "beta", 5, config)).hasSize(1);
    }

    @Test
    void query_unknownProvider_returnsNoMatches() {
        EmbeddingConfig broken = new EmbeddingConfig("nonexistent", "m", null, null);

        assertThat(memory.query(SESSION, "anything", 5, broken)).isEmpty();
        assertThat(memory.ingest(SESSION, "doc", "text to index", null, broken).status()).isEqualTo(IngestResult.FAILED);
    }
}
