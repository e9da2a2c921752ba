package com.delta.listingtracker.config;

import com.delta.listingtracker.crawl.http.PoliteHttpClient;
import com.delta.listingtracker.crawl.render.HttpRenderSessionFactory;
import com.delta.listingtracker.crawl.render.PlaywrightRenderSessionFactory;
import com.delta.listingtracker.crawl.render.RenderSessionFactory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CrawlConfig {
    private static final Logger log = LoggerFactory.getLogger(CrawlConfig.class);

    @Bean(name = "crawlExecutor", destroyMethod = "shutdown")
    public ExecutorService crawlExecutor(CrawlerProperties properties) {
        return Executors.newFixedThreadPool(properties.getGlobalConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(CrawlerProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "crawlRunExecutor", destroyMethod = "shutdown")
    public ExecutorService crawlRunExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public RenderSessionFactory renderSessionFactory(CrawlerProperties properties, PoliteHttpClient httpClient) {
        String engine = properties.getBrowser().getEngine();
        if ("http".equals(engine)) {
            log.info("Using plain HTTP render sessions");
            return new HttpRenderSessionFactory(httpClient);
        }
        if (!"playwright".equals(engine)) {
            log.warn("Unknown browser engine '{}', falling back to playwright", engine);
        }
        return new PlaywrightRenderSessionFactory(properties.getBrowser());
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
