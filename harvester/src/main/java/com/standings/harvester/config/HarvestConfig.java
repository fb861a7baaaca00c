package com.standings.harvester.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.standings.harvester.harvest.retry.BackoffPolicy;
import com.standings.harvester.harvest.retry.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class HarvestConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(HarvesterProperties properties) {
        int size = Math.max(4, properties.getConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public BackoffPolicy backoffPolicy(HarvesterProperties properties) {
        return BackoffPolicy.fromProperties(properties.getRetry());
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
