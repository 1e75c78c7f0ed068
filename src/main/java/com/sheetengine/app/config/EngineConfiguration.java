package com.sheetengine.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sheetengine.app.engine.functions.FunctionRegistry;
import com.sheetengine.app.events.EventBus;
import com.sheetengine.app.events.SpringEventBus;
import com.sheetengine.app.persistence.DocumentCache;
import com.sheetengine.app.persistence.DocumentStore;
import com.sheetengine.app.persistence.InMemoryDocumentCache;
import com.sheetengine.app.persistence.InMemoryDocumentStore;
import com.sheetengine.app.persistence.WorkbookSerializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Engine beans. Store, cache and bus default to in-process implementations;
 * declaring another bean of the same type replaces them.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public FunctionRegistry functionRegistry() {
        return FunctionRegistry.standard();
    }

    @Bean
    public WorkbookSerializer workbookSerializer(ObjectMapper objectMapper) {
        return new WorkbookSerializer(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentStore documentStore() {
        return new InMemoryDocumentStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentCache documentCache(Clock clock) {
        return new InMemoryDocumentCache(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventBus eventBus(ApplicationEventPublisher publisher) {
        return new SpringEventBus(publisher);
    }
}
