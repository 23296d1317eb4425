package com.delta.jobimporter.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableScheduling
public class ImportConfig {

    @Bean(name = "feedExecutor", destroyMethod = "shutdown")
    public ExecutorService feedExecutor(ImporterProperties properties) {
        return Executors.newFixedThreadPool(properties.getFeed().getMaxParallelFetches());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ImporterProperties properties) {
        int size = Math.max(4, properties.getFeed().getMaxParallelFetches());
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "batchExecutor", destroyMethod = "shutdown")
    public ExecutorService batchExecutor(ImporterProperties properties) {
        return Executors.newFixedThreadPool(Math.max(2, properties.getWorker().getConcurrency()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
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
