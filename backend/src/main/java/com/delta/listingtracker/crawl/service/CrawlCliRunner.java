package com.delta.listingtracker.crawl.service;

import com.delta.listingtracker.config.CrawlerProperties;
import com.delta.listingtracker.crawl.model.CrawlRunRequest;
import com.delta.listingtracker.crawl.model.CrawlRunSummary;
import com.delta.listingtracker.crawl.model.TargetRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        CrawlOrchestratorService crawlOrchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        String configured = properties.getCli().getPlatforms() == null ? "" : properties.getCli().getPlatforms();
        List<String> platforms = Arrays.stream(configured.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();

        CrawlRunSummary summary = crawlOrchestratorService.run(new CrawlRunRequest(platforms, null, null));
        log.info("Crawl run {} completed with status {}", summary.runId(), summary.status());
        for (TargetRunSummary target : summary.targets()) {
            log.info(
                "Summary {} '{}': status={}, pages={}/{}, items={}, sold={}, new={}, updated={}, error={}",
                target.platform(),
                target.targetKey(),
                target.status(),
                target.run() == null ? null : target.run().pagesAttempted(),
                target.run() == null ? null : target.run().pagesTotalDetected(),
                target.run() == null ? null : target.run().itemsCollected(),
                target.detection() == null ? null : target.detection().soldCount(),
                target.detection() == null ? null : target.detection().newCount(),
                target.detection() == null ? null : target.detection().updatedCount(),
                target.error()
            );
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
