package com.cinemaregistry.config;

import com.cinemaregistry.scrape.rate.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ScraperConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ScraperProperties properties) {
        int size = Math.max(4, properties.getCli().getWorkerCount() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "scrapeRunExecutor", destroyMethod = "shutdown")
    public ExecutorService scrapeRunExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
