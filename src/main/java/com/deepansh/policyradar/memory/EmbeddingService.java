package com.deepansh.policyradar.memory;

import com.deepansh.policyradar.config.RadarProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Embeds texts under a given {@link EmbeddingConfig}.
 *
 * - Providers are built lazily and cached per (namespace, key). The cache is bounded by
 *   {@code max-cached-providers} and evicts the least recently used provider.
 * - Texts go out in batches of {@code embed-batch-size}; each batch is retried with
 *   exponential backoff via the "embedding" retry instance.
 * - When retries are exhausted the whole call returns an empty list. Callers treat that
 *   as "cannot embed" rather than an error.
 * - Vectors are cached in Redis under embed:{namespace}:{sha256(text)}, read with one
 *   MGET per batch. The first cache failure disables the cache for the rest of the call.
 */
@Service
@Slf4j
public class EmbeddingService {

    private static final String CACHE_PREFIX = "embed:";

    private final RadarProperties.Embedding embeddingProps;
    private final int batchSize;
    private final RestClient.Builder restClientBuilder;
    private final Retry retry;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Map<String, EmbeddingProvider> providers;

    @Autowired
    public EmbeddingService(RadarProperties properties,
                            RestClient.Builder restClientBuilder,
                            @Qualifier("embeddingRetry") Retry retry,
                            ObjectProvider<StringRedisTemplate> redisTemplate,
                            ObjectMapper objectMapper) {
        this(properties, restClientBuilder, retry, redisTemplate.getIfAvailable(), objectMapper);
    }

    EmbeddingService(RadarProperties properties,
                     RestClient.Builder restClientBuilder,
                     Retry retry,
                     StringRedisTemplate redisTemplate,
                     ObjectMapper objectMapper) {
        this.embeddingProps = properties.getEmbedding();
        this.batchSize = Math.max(1, properties.getMemory().getEmbedBatchSize());
        this.restClientBuilder = restClientBuilder;
        this.retry = retry;
        this.redisTemplate = embeddingProps.isCacheEnabled() ? redisTemplate : null;
        this.objectMapper = objectMapper;
        int maxProviders = Math.max(1, embeddingProps.getMaxCachedProviders());
        this.providers = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, EmbeddingProvider> eldest) {
                return size() > maxProviders;
            }
        };
    }

    public EmbeddingConfig defaultConfig() {
        return EmbeddingConfig.from(embeddingProps);
    }

    /**
     * @return one vector per text in order, or an empty list if embedding failed
     */
    public List<float[]> embed(EmbeddingConfig config, List<String> texts) {
        if (texts.isEmpty()) return List.of();
        EmbeddingProvider provider;
        try {
            provider = providerFor(config);
        } catch (IllegalArgumentException e) {
            log.warn("Embedding provider unavailable [{}]: {}", config, e.getMessage());
            return List.of();
        }

        VectorCache cache = new VectorCache(config.namespace());
        List<float[]> out = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            List<String> batch = texts.subList(from, Math.min(texts.size(), from + batchSize));
            List<float[]> vectors = embedBatch(provider, cache, batch);
            if (vectors.size() != batch.size()) {
                log.error("Embedding failed after retries [{}], batch {}-{} of {}",
                        config, from, from + batch.size(), texts.size());
                return List.of();
            }
            out.addAll(vectors);
        }
        return out;
    }

    private List<float[]> embedBatch(EmbeddingProvider provider, VectorCache cache, List<String> batch) {
        float[][] result = cache.read(batch);
        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            if (result[i] == null) missing.add(i);
        }
        if (!missing.isEmpty()) {
            List<String> toEmbed = missing.stream().map(batch::get).toList();
            List<float[]> fresh;
            try {
                fresh = Retry.decorateSupplier(retry, () -> provider.embed(toEmbed)).get();
            } catch (RuntimeException e) {
                log.warn("Embedding batch failed [size={}]: {}", toEmbed.size(), e.getMessage());
                return List.of();
            }
            if (fresh.size() != toEmbed.size()) return List.of();
            for (int j = 0; j < missing.size(); j++) {
                result[missing.get(j)] = fresh.get(j);
                cache.write(toEmbed.get(j), fresh.get(j));
            }
        }
        return List.of(result);
    }

    EmbeddingProvider providerFor(EmbeddingConfig config) {
        synchronized (providers) {
            EmbeddingProvider provider = providers.get(config.instanceKey());
            if (provider == null) {
                provider = createProvider(config);
                providers.put(config.instanceKey(), provider);
            }
            return provider;
        }
    }

    int cachedProviderCount() {
        synchronized (providers) {
            return providers.size();
        }
    }

    private EmbeddingProvider createProvider(EmbeddingConfig config) {
        log.info("Creating embedding provider {}", config);
        return switch (config.provider()) {
            case "local" -> new HashingEmbeddingProvider(localDimensions(config.model()));
            case "openai" -> new OpenAiEmbeddingProvider(restClientBuilder,
                    orDefault(config.baseUrl(), "https://api.openai.com/v1"), config.apiKey(),
                    orDefault(config.model(), "text-embedding-3-small"), "OpenAI");
            case "custom" -> {
                if (config.baseUrl().isBlank()) {
                    throw new IllegalArgumentException("custom embedding provider needs a base url");
                }
                yield new OpenAiEmbeddingProvider(restClientBuilder, config.baseUrl(), config.apiKey(),
                        config.model(), "Custom");
            }
            case "gemini" -> new GeminiEmbeddingProvider(restClientBuilder,
                    orDefault(config.baseUrl(), "https://generativelanguage.googleapis.com/v1beta"),
                    config.apiKey(), orDefault(config.model(), "text-embedding-004"));
            case "huggingface" -> new HuggingFaceEmbeddingProvider(restClientBuilder,
                    orDefault(config.baseUrl(), "https://api-inference.huggingface.co"), config.apiKey(),
                    orDefault(config.model(), "sentence-transformers/all-MiniLM-L6-v2"));
            default -> throw new IllegalArgumentException("unknown embedding provider: " + config.provider());
        };
    }

    /** "hashing-512" selects 512 dimensions; anything else uses local-dimensions. */
    private int localDimensions(String model) {
        if (model != null && model.startsWith("hashing-")) {
            try {
                return Integer.parseInt(model.substring("hashing-".length()));
            } catch (NumberFormatException ignored) {
                log.debug("Unparsable hashing model name '{}', using configured dimensions", model);
            }
        }
        return embeddingProps.getLocalDimensions();
    }

    /** Redis view for one embed call; stops touching Redis after its first failure. */
    private final class VectorCache {

        private final String namespace;
        private boolean available;

        VectorCache(String namespace) {
            this.namespace = namespace;
            this.available = redisTemplate != null;
        }

        float[][] read(List<String> texts) {
            float[][] vectors = new float[texts.size()][];
            if (!available) return vectors;
            try {
                List<String> cached = redisTemplate.opsForValue()
                        .multiGet(texts.stream().map(t -> cacheKey(namespace, t)).toList());
                if (cached == null) return vectors;
                for (int i = 0; i < vectors.length && i < cached.size(); i++) {
                    String value = cached.get(i);
                    if (value != null) vectors[i] = objectMapper.readValue(value, float[].class);
                }
            } catch (Exception e) {
                available = false;
                log.warn("Embedding cache read failed, skipping cache for this call: {}", e.getMessage());
                return new float[texts.size()][];
            }
            return vectors;
        }

        void write(String text, float[] vector) {
            if (!available) return;
            try {
                Duration ttl = embeddingProps.getCacheTtl();
                redisTemplate.opsForValue().set(cacheKey(namespace, text), objectMapper.writeValueAsString(vector), ttl);
            } catch (Exception e) {
                available = false;
                log.warn("Embedding cache write failed, skipping cache for this call: {}", e.getMessage());
            }
        }
    }

    private static String cacheKey(String namespace, String text) {
        return CACHE_PREFIX + namespace + ":" + Hashing.sha256(text);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
