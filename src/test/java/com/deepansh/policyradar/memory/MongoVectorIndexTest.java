package com.deepansh.policyradar.memory;

import com.mongodb.client.result.DeleteResult;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexDefinition;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoVectorIndexTest {

    private static final String PREFIX = "pdf_memory_";
    private static final String REGISTRY = PREFIX + "namespaces";
    private static final String NAMESPACE = "emb_abc123";

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private IndexOperations indexOps;

    private MongoVectorIndex index;

    @BeforeEach
    void setUp() {
        index = new MongoVectorIndex(mongoTemplate, PREFIX);
    }

    @Test
    void dimension_readsRegistryOnceThenCaches() {
        when(mongoTemplate.findById(NAMESPACE, Document.class, REGISTRY))
                .thenReturn(new Document("dimension", 384).append("collection", PREFIX + NAMESPACE));

        assertThat(index.dimension(NAMESPACE)).isEqualTo(384);
        assertThat(index.dimension(NAMESPACE)).isEqualTo(384);

        verify(mongoTemplate, times(1)).findById(NAMESPACE, Document.class, REGISTRY);
    }

    @Test
    void dimension_unknownNamespace_isNegative() {
        when(mongoTemplate.findById(NAMESPACE, Document.class, REGISTRY)).thenReturn(null);

        assertThat(index.dimension(NAMESPACE)).isEqualTo(-1);
    }

    @Test
    void replaceDocument_newNamespace_registersDimensionAndInserts() {
        when(mongoTemplate.findById(NAMESPACE, Document.class, REGISTRY)).thenReturn(null);
        when(mongoTemplate.indexOps(PREFIX + NAMESPACE)).thenReturn(indexOps);

        index.replaceDocument(NAMESPACE, "s1", "doc-1", List.of(chunk("s1", 3)));

        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).upsert(any(Query.class), update.capture(), eq(REGISTRY));
        assertThat(update.getValue().getUpdateObject().get("$set", Document.class).getInteger("dimension")).isEqualTo(3);
        verify(indexOps).ensureIndex(any(IndexDefinition.class));
        verify(mongoTemplate).remove(any(Query.class), eq(PREFIX + NAMESPACE));
        verify(mongoTemplate).insert(anyList(), eq(PREFIX + NAMESPACE));
        assertThat(index.dimension(NAMESPACE)).isEqualTo(3);
    }

    @Test
    void replaceDocument_dimensionMismatch_throwsWithoutWriting() {
        when(mongoTemplate.findById(NAMESPACE, Document.class, REGISTRY))
                .thenReturn(new Document("dimension", 384));

        assertThatThrownBy(() -> index.replaceDocument(NAMESPACE, "s1", "doc-1", List.of(chunk("s1", 64))))
                .isInstanceOf(DimensionMismatchException.class)
                .satisfies(e -> {
                    DimensionMismatchException mismatch = (DimensionMismatchException) e;
                    assertThat(mismatch.getExpected()).isEqualTo(384);
                    assertThat(mismatch.getActual()).isEqualTo(64);
                });

        verify(mongoTemplate, never()).remove(any(Query.class), anyString());
        verify(mongoTemplate, never()).insert(anyList(), anyString());
    }

    @Test
    void recreateNamespace_dropsCollectionAndReregistersNewDimension() {
        when(mongoTemplate.findById(NAMESPACE, Document.class, REGISTRY))
                .thenReturn(new Document("dimension", 384));
        when(mongoTemplate.indexOps(PREFIX + NAMESPACE)).thenReturn(indexOps);
        assertThat(index.dimension(NAMESPACE)).isEqualTo(384);

        index.recreateNamespace(NAMESPACE, 64);
        index.replaceDocument(NAMESPACE, "s1", "doc-1", List.of(chunk("s1", 64)));

        verify(mongoTemplate).dropCollection(PREFIX + NAMESPACE);
        verify(mongoTemplate).upsert(any(Query.class), any(Update.class), eq(REGISTRY));
        verify(mongoTemplate).insert(anyList(), eq(PREFIX + NAMESPACE));
        assertThat(index.dimension(NAMESPACE)).isEqualTo(64);
    }

    @Test
    void deleteSession_walksEveryRegisteredNamespace() {
        when(mongoTemplate.findAll(Document.class, REGISTRY)).thenReturn(List.of(
                new Document("_id", "emb_one").append("collection", PREFIX + "emb_one"),
                new Document("_id", "emb_two").append("collection", PREFIX + "emb_two"),
                new Document("_id", "broken")));
        when(mongoTemplate.remove(any(Query.class), eq(PREFIX + "emb_one"))).thenReturn(DeleteResult.acknowledged(4));
        when(mongoTemplate.remove(any(Query.class), eq(PREFIX + "emb_two"))).thenReturn(DeleteResult.acknowledged(1));

        long deleted = index.deleteSession("s1");

        assertThat(deleted).isEqualTo(5);
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).remove(query.capture(), eq(PREFIX + "emb_one"));
        assertThat(query.getValue().getQueryObject().getString("sessionId")).isEqualTo("s1");
    }

    @Test
    void deleteSession_neverIndexed_removesNothing() {
        when(mongoTemplate.findAll(Document.class, REGISTRY)).thenReturn(Collections.emptyList());

        assertThat(index.deleteSession("ghost")).isZero();
        verify(mongoTemplate, never()).remove(any(Query.class), anyString());
    }

    private static MemoryChunk chunk(String session, int dimension) {
        return MemoryChunk.builder()
                .id(session + "_doc_0")
                .sessionId(session)
                .docKey("doc-1")
                .text("text")
                .embedding(Collections.nCopies(dimension, 0.5))
                .docHash("hash")
                .build();
    }
}
