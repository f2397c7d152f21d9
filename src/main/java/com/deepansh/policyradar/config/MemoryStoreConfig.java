package com.deepansh.policyradar.config;

import com.deepansh.policyradar.memory.InMemoryVectorIndex;
import com.deepansh.policyradar.memory.MongoVectorIndex;
import com.deepansh.policyradar.memory.VectorIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Picks the vector index implementation from radar.memory.store (mongo | in-memory).
 */
@Configuration
@Slf4j
public class MemoryStoreConfig {

    @Bean
    public VectorIndex vectorIndex(RadarProperties properties, ObjectProvider<MongoTemplate> mongoTemplate) {
        RadarProperties.Memory memory = properties.getMemory();
        if ("in-memory".equalsIgnoreCase(memory.getStore())) {
            log.info("Retrieval memory store: in-memory");
            return new InMemoryVectorIndex();
        }
        MongoTemplate template = mongoTemplate.getIfAvailable();
        if (template == null) {
            log.warn("No MongoTemplate available, falling back to in-memory retrieval store");
            return new InMemoryVectorIndex();
        }
        log.info("Retrieval memory store: mongo [prefix={}]", memory.getCollectionPrefix());
        return new MongoVectorIndex(template, memory.getCollectionPrefix());
    }
}
