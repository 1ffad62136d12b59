package com.valuescreen.loader.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.valuescreen.loader.ingest.http.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class LoaderConfig {

    @Bean(name = "fetchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(LoaderProperties properties) {
        int size = Math.max(2, properties.getStream().getFetchConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "writeExecutor", destroyMethod = "shutdown")
    public ExecutorService writeExecutor(LoaderProperties properties) {
        int size = Math.max(2, properties.getStream().getWriteConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(LoaderProperties properties) {
        int size = Math.max(4, properties.getStream().getFetchConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public RateLimiter rateLimiter(LoaderProperties properties) {
        return new RateLimiter(properties.getApi().getRequestsPerSecond());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        return mapper;
    }
}
