package com.kinoscope.metadata.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kinoscope.metadata.resolve.service.SupplementalSourceClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ResolverConfig {

    @Bean(name = "resolveExecutor", destroyMethod = "shutdown")
    public ExecutorService resolveExecutor(ResolverProperties properties) {
        return Executors.newFixedThreadPool(properties.getGlobalConcurrency());
    }

    @Bean
    @ConditionalOnMissingBean(SupplementalSourceClient.class)
    public SupplementalSourceClient supplementalSourceClient() {
        return SupplementalSourceClient.NONE;
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
