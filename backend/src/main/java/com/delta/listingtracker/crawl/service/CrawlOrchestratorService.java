package com.delta.listingtracker.crawl.service;

import com.delta.listingtracker.config.CrawlerProperties;
import com.delta.listingtracker.crawl.model.CrawlRunRequest;
import com.delta.listingtracker.crawl.model.CrawlRunSummary;
import com.delta.listingtracker.crawl.model.ScrapeRunResult;
import com.delta.listingtracker.crawl.model.TargetCrawlOutcome;
import com.delta.listingtracker.crawl.model.TargetDetectionResult;
import com.delta.listingtracker.crawl.model.TargetRunSummary;
import com.delta.listingtracker.crawl.model.TerminationReason;
import com.delta.listingtracker.crawl.persistence.ScrapeRunLogRepository;
import com.delta.listingtracker.crawl.persistence.SnapshotStore;
import com.delta.listingtracker.crawl.platform.MarketplacePlatform;
import com.delta.listingtracker.crawl.platform.PlatformRegistry;
import com.delta.listingtracker.crawl.util.ReasonCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);

    static final String STATUS_SUCCESS = "success";
    static final String STATUS_INCOMPLETE = "incomplete";
    static final String STATUS_FAILED = "failed";

    private final PlatformRegistry platformRegistry;
    private final TargetCrawlerService targetCrawlerService;
    private final SaleDetectionService saleDetectionService;
    private final ScrapeRunLogRepository runLogRepository;
    private final SnapshotStore snapshotStore;
    private final ExecutorService crawlExecutor;
    private final ExecutorService crawlRunExecutor;
    private final CrawlerProperties properties;
    private final AtomicBoolean active = new AtomicBoolean(false);
    private final AtomicReference<CrawlRunSummary> latest = new AtomicReference<>();

    public CrawlOrchestratorService(
        PlatformRegistry platformRegistry,
        TargetCrawlerService targetCrawlerService,
        SaleDetectionService saleDetectionService,
        ScrapeRunLogRepository runLogRepository,
        SnapshotStore snapshotStore,
        @Qualifier("crawlExecutor") ExecutorService crawlExecutor,
        @Qualifier("crawlRunExecutor") ExecutorService crawlRunExecutor,
        CrawlerProperties properties
    ) {
        this.platformRegistry = platformRegistry;
        this.targetCrawlerService = targetCrawlerService;
        this.saleDetectionService = saleDetectionService;
        this.runLogRepository = runLogRepository;
        this.snapshotStore = snapshotStore;
        this.crawlExecutor = crawlExecutor;
        this.crawlRunExecutor = crawlRunExecutor;
        this.properties = properties;
    }

    public CrawlRunSummary run(CrawlRunRequest request) {
        ensureNoActiveRun();
        try {
            return execute(UUID.randomUUID().toString(), request);
        } finally {
            active.set(false);
        }
    }

    public String startAsync(CrawlRunRequest request) {
        ensureNoActiveRun();
        String runId = UUID.randomUUID().toString();
        try {
            crawlRunExecutor.submit(() -> {
                try {
                    execute(runId, request);
                } catch (Exception e) {
                    log.warn("Crawl run {} failed", runId, e);
                } finally {
                    active.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            active.set(false);
            throw e;
        }
        return runId;
    }

    public boolean isActive() {
        return active.get();
    }

    public Optional<CrawlRunSummary> latest() {
        return Optional.ofNullable(latest.get());
    }

    private void ensureNoActiveRun() {
        if (!active.compareAndSet(false, true)) {
            throw new ActiveCrawlRunException("Active crawl run in progress");
        }
    }

    private CrawlRunSummary execute(String runId, CrawlRunRequest request) {
        CrawlRunRequest safeRequest = request == null ? new CrawlRunRequest(List.of(), null, null) : request;
        Instant startedAt = Instant.now();
        LocalDate snapshotDate = safeRequest.snapshotDate() == null ? LocalDate.now() : safeRequest.snapshotDate();
        List<String> requested = safeRequest.normalizedPlatforms();
        List<String> platformNames = requested.isEmpty() ? platformRegistry.enabledNames() : requested;
        log.info("Crawl run {} started for {} on {}", runId, platformNames, snapshotDate);

        List<TargetRunSummary> summaries = new ArrayList<>();
        List<PendingTarget> pending = new ArrayList<>();
        for (String name : platformNames) {
            Optional<MarketplacePlatform> platform = platformRegistry.find(name);
            if (platform.isEmpty()) {
                log.warn("Crawl run {}: unknown platform '{}' (known: {})", runId, name, platformRegistry.names());
                summaries.add(new TargetRunSummary(name, null, STATUS_FAILED, null, null, ReasonCodes.UNKNOWN_PLATFORM));
                continue;
            }
            CrawlerProperties.Platform settings = properties.platform(name);
            if (settings.getTargets().isEmpty()) {
                log.info("Crawl run {}: platform '{}' has no targets", runId, name);
                continue;
            }
            for (String target : settings.getTargets()) {
                pending.add(new PendingTarget(platform.get(), target, CompletableFuture.supplyAsync(
                    () -> targetCrawlerService.crawl(platform.get(), target, safeRequest.maxPages()),
                    crawlExecutor
                )));
            }
        }

        boolean hadErrors = !summaries.isEmpty();
        for (PendingTarget target : pending) {
            TargetRunSummary summary = closeOut(runId, snapshotDate, target);
            summaries.add(summary);
            if (!STATUS_SUCCESS.equals(summary.status())) {
                hadErrors = true;
            }
        }

        pruneInventory(snapshotDate);

        String status;
        if (pending.isEmpty() && summaries.isEmpty()) {
            status = "NO_TARGETS";
        } else {
            status = hadErrors ? "COMPLETED_WITH_ERRORS" : "COMPLETED";
        }
        CrawlRunSummary summary = new CrawlRunSummary(runId, startedAt, Instant.now(), status, summaries);
        latest.set(summary);
        log.info("Crawl run {} finished with status {} ({} targets)", runId, status, summaries.size());
        return summary;
    }

    private TargetRunSummary closeOut(String runId, LocalDate snapshotDate, PendingTarget target) {
        String platform = target.platform().name();
        ScrapeRunResult run = null;
        TargetDetectionResult detection = null;
        String status;
        String error = null;
        try {
            TargetCrawlOutcome outcome = target.future().join();
            run = outcome.result();
            detection = saleDetectionService.process(run, outcome.listings(), snapshotDate);
            status = detection.scraperIncomplete() ? STATUS_INCOMPLETE : STATUS_SUCCESS;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Target crawl failed for {} '{}'", platform, target.target(), cause);
            error = ReasonCodes.describe(cause);
            status = STATUS_FAILED;
            run = failedRun(platform, target.target());
        } catch (Exception e) {
            log.warn("Sale detection failed for {} '{}'", platform, target.target(), e);
            error = ReasonCodes.describe(e);
            status = STATUS_FAILED;
            if (run == null) {
                run = failedRun(platform, target.target());
            }
        }
        try {
            runLogRepository.insert(runId, snapshotDate, platform, target.target(), status, run, detection, error);
        } catch (Exception e) {
            log.warn("Unable to write scrape run log for {} '{}'", platform, target.target(), e);
        }
        return new TargetRunSummary(platform, target.target(), status, run, detection, error);
    }

    private void pruneInventory(LocalDate snapshotDate) {
        int days = properties.getRetention().getInventoryDays();
        if (days <= 0) {
            return;
        }
        try {
            int removed = snapshotStore.deleteSnapshotsBefore(snapshotDate.minusDays(days));
            if (removed > 0) {
                log.info("Pruned {} inventory rows older than {} days", removed, days);
            }
        } catch (Exception e) {
            log.warn("Inventory pruning failed", e);
        }
    }

    private static ScrapeRunResult failedRun(String platform, String target) {
        Instant now = Instant.now();
        return new ScrapeRunResult(platform, target, 0, 0, null, null, 0, 0, 0, 0, List.of(), TerminationReason.ERROR, now, now);
    }

    private record PendingTarget(MarketplacePlatform platform, String target, CompletableFuture<TargetCrawlOutcome> future) {
    }
}
