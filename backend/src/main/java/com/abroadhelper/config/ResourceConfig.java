package com.abroadhelper.config;

import com.abroadhelper.resources.http.RateLimiter;
import com.abroadhelper.resources.http.Sleeper;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ResourceConfig {

    @Bean(name = "linkCheckExecutor", destroyMethod = "shutdown")
    public ExecutorService linkCheckExecutor(ResourceProperties properties) {
        return Executors.newFixedThreadPool(properties.getLinkCheck().getConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ResourceProperties properties) {
        int size = Math.max(4, properties.getLinkCheck().getConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public RateLimiter rateLimiter(ResourceProperties properties, Clock clock, Sleeper sleeper) {
        return new RateLimiter(properties.getRequestDelay(), clock, sleeper);
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
