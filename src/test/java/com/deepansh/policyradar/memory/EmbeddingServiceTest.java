package com.deepansh.policyradar.memory;

import com.deepansh.policyradar.config.RadarProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingServiceTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOps;

    private RadarProperties properties;

    @BeforeEach
    void setUp() {
        properties = new RadarProperties();
        properties.getEmbedding().setModel("hashing-8");
    }

    private EmbeddingService service(StringRedisTemplate redis) {
        return new EmbeddingService(properties, RestClient.builder(), Retry.ofDefaults("test"), redis, new ObjectMapper());
    }

    @Test
    void embed_readsCacheWithOneMultiGetPerBatch() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.multiGet(anyList())).thenReturn(Arrays.asList("[1.0,0.0,0.0]", null, null));
        EmbeddingService service = service(redisTemplate);

        List<float[]> vectors = service.embed(service.defaultConfig(), List.of("cached", "fresh one", "fresh two"));

        assertThat(vectors).hasSize(3);
        assertThat(vectors.get(0)).containsExactly(1.0f, 0.0f, 0.0f);
        assertThat(vectors.get(1)).hasSize(8);
        verify(valueOps, times(1)).multiGet(anyList());
        verify(valueOps, never()).get(anyString());
        verify(valueOps, times(2)).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void embed_redisDown_skipsCacheForRestOfCallAndStillEmbeds() {
        properties.getMemory().setEmbedBatchSize(2);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.multiGet(anyList())).thenThrow(new RedisConnectionFailureException("refused"));
        EmbeddingService service = service(redisTemplate);

        List<float[]> vectors = service.embed(service.defaultConfig(), List.of("a1", "a2", "a3", "a4"));

        assertThat(vectors).hasSize(4).allSatisfy(v -> assertThat(v).hasSize(8));
        verify(valueOps, times(1)).multiGet(anyList());
        verify(valueOps, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void providerFor_manyRequestKeys_keepsCacheBounded() {
        properties.getEmbedding().setMaxCachedProviders(3);
        EmbeddingService service = service(null);

        EmbeddingConfig first = new EmbeddingConfig("openai", "text-embedding-3-small", "key-0", "");
        EmbeddingProvider firstProvider = service.providerFor(first);
        for (int i = 1; i < 50; i++) {
            service.providerFor(new EmbeddingConfig("openai", "text-embedding-3-small", "key-" + i, ""));
        }

        assertThat(service.cachedProviderCount()).isEqualTo(3);
        assertThat(service.providerFor(first)).isNotSameAs(firstProvider);
    }

    @Test
    void providerFor_recentlyUsedConfig_isReused() {
        properties.getEmbedding().setMaxCachedProviders(2);
        EmbeddingService service = service(null);
        EmbeddingConfig hot = new EmbeddingConfig("openai", "m", "hot-key", "");

        EmbeddingProvider provider = service.providerFor(hot);
        service.providerFor(new EmbeddingConfig("openai", "m", "other-1", ""));
        service.providerFor(hot);
        service.providerFor(new EmbeddingConfig("openai", "m", "other-2", ""));

        assertThat(service.providerFor(hot)).isSameAs(provider);
    }
}
