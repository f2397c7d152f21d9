package com.deepansh.policyradar.memory;

import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * MongoDB-backed index: one collection per namespace plus a registry collection that
 * records each namespace's dimension.
 *
 * Similarity is computed in-process over the session's rows, as with any MongoDB
 * deployment that lacks Atlas Vector Search. Session scoping keeps the candidate
 * set to one user's documents.
 */
@Slf4j
public class MongoVectorIndex implements VectorIndex {

    private final MongoTemplate mongoTemplate;
    private final String collectionPrefix;
    private final String registryCollection;

    /** namespace -> dimension for namespaces confirmed in the registry */
    private final Map<String, Integer> knownNamespaces = new ConcurrentHashMap<>();

    public MongoVectorIndex(MongoTemplate mongoTemplate, String collectionPrefix) {
        this.mongoTemplate = mongoTemplate;
        this.collectionPrefix = collectionPrefix;
        this.registryCollection = collectionPrefix + "namespaces";
    }

    @Override
    public int dimension(String namespace) {
        Integer cached = knownNamespaces.get(namespace);
        if (cached != null) return cached;
        Document entry = mongoTemplate.findById(namespace, Document.class, registryCollection);
        if (entry == null) return -1;
        int dimension = entry.getInteger("dimension", -1);
        knownNamespaces.put(namespace, dimension);
        return dimension;
    }

    @Override
    public boolean hasDocument(String namespace, String sessionId, String docKey, String docHash) {
        if (dimension(namespace) < 0) return false;
        Query query = new Query(Criteria.where("sessionId").is(sessionId)
                .and("docKey").is(docKey)
                .and("docHash").is(docHash));
        return mongoTemplate.exists(query, collectionName(namespace));
    }

    @Override
    public void replaceDocument(String namespace, String sessionId, String docKey, List<MemoryChunk> chunks) {
        if (chunks.isEmpty()) return;
        int dimension = chunks.get(0).dimension();
        int existing = dimension(namespace);
        if (existing < 0) {
            createNamespace(namespace, dimension);
        } else if (existing != dimension) {
            throw new DimensionMismatchException(namespace, existing, dimension);
        }

        String collection = collectionName(namespace);
        mongoTemplate.remove(new Query(Criteria.where("sessionId").is(sessionId).and("docKey").is(docKey)), collection);
        mongoTemplate.insert(chunks, collection);
        log.debug("Stored {} chunks in {} [session={}, doc={}]", chunks.size(), collection, sessionId, docKey);
    }

    @Override
    public void recreateNamespace(String namespace, int dimension) {
        log.warn("Recreating namespace {} with dimension {}", namespace, dimension);
        mongoTemplate.dropCollection(collectionName(namespace));
        knownNamespaces.remove(namespace);
        createNamespace(namespace, dimension);
    }

    @Override
    public List<MemoryMatch> search(String namespace, String sessionId, float[] query, int topK) {
        if (dimension(namespace) < 0) return List.of();
        List<MemoryChunk> candidates = mongoTemplate.find(
                new Query(Criteria.where("sessionId").is(sessionId)), MemoryChunk.class, collectionName(namespace));

        return candidates.stream()
                .filter(c -> c.getEmbedding() != null && !c.getEmbedding().isEmpty())
                .map(c -> MemoryMatch.of(c, VectorMath.cosineSimilarity(query, VectorMath.toFloatArray(c.getEmbedding()))))
                .sorted(Comparator.comparingDouble(MemoryMatch::score).reversed())
                .limit(topK)
                .toList();
    }

    @Override
    public long deleteSession(String sessionId) {
        long removed = 0;
        for (Document entry : mongoTemplate.findAll(Document.class, registryCollection)) {
            String collection = entry.getString("collection");
            if (collection == null) continue;
            removed += mongoTemplate.remove(new Query(Criteria.where("sessionId").is(sessionId)), collection)
                    .getDeletedCount();
        }
        log.info("Deleted {} memory chunks [session={}]", removed, sessionId);
        return removed;
    }

    private void createNamespace(String namespace, int dimension) {
        String collection = collectionName(namespace);
        log.info("Creating memory namespace {} [collection={}, dim={}]", namespace, collection, dimension);
        mongoTemplate.indexOps(collection).ensureIndex(new Index()
                .on("sessionId", Sort.Direction.ASC)
                .on("docKey", Sort.Direction.ASC)
                .named("session_doc"));
        mongoTemplate.upsert(
                new Query(Criteria.where("_id").is(namespace)),
                new Update().set("dimension", dimension)
                        .set("collection", collection)
                        .set("createdAt", Instant.now()),
                registryCollection);
        knownNamespaces.put(namespace, dimension);
    }

    private String collectionName(String namespace) {
        return collectionPrefix + namespace;
    }
}
