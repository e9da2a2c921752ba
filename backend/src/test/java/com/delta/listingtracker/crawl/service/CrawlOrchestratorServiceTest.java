package com.delta.listingtracker.crawl.service;

import com.delta.listingtracker.config.CrawlerProperties;
import com.delta.listingtracker.crawl.model.CoverageDecision;
import com.delta.listingtracker.crawl.model.CrawlRunRequest;
import com.delta.listingtracker.crawl.model.CrawlRunSummary;
import com.delta.listingtracker.crawl.model.ScrapeRunResult;
import com.delta.listingtracker.crawl.model.TargetCrawlOutcome;
import com.delta.listingtracker.crawl.model.TargetDetectionResult;
import com.delta.listingtracker.crawl.model.TargetRunSummary;
import com.delta.listingtracker.crawl.model.TerminationReason;
import com.delta.listingtracker.crawl.persistence.ScrapeRunLogRepository;
import com.delta.listingtracker.crawl.persistence.SnapshotStore;
import com.delta.listingtracker.crawl.platform.PlatformRegistry;
import com.delta.listingtracker.crawl.util.ReasonCodes;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlOrchestratorServiceTest {
    private static final LocalDate DAY = LocalDate.of(2026, 10, 18);

    @Mock
    private TargetCrawlerService targetCrawlerService;
    @Mock
    private SaleDetectionService saleDetectionService;
    @Mock
    private ScrapeRunLogRepository runLogRepository;
    @Mock
    private SnapshotStore snapshotStore;

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final ExecutorService runExecutor = Executors.newSingleThreadExecutor();
    private CrawlerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.getRetention().setInventoryDays(0);
        CrawlerProperties.Platform chrono24 = new CrawlerProperties.Platform();
        chrono24.setEnabled(true);
        chrono24.setTargets(List.of("omega", "rolex"));
        properties.getPlatforms().put("chrono24", chrono24);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        runExecutor.shutdownNow();
    }

    @Test
    void failedTargetDoesNotAbortSiblings() {
        ScrapeRunResult omegaRun = run("omega");
        when(targetCrawlerService.crawl(any(), eq("omega"), any())).thenReturn(new TargetCrawlOutcome(omegaRun, List.of()));
        when(targetCrawlerService.crawl(any(), eq("rolex"), any())).thenThrow(new IllegalStateException("browser crashed"));
        when(saleDetectionService.process(eq(omegaRun), any(), eq(DAY))).thenReturn(detection("omega", false));

        CrawlRunSummary summary = service().run(new CrawlRunRequest(List.of(), null, DAY));

        assertEquals("COMPLETED_WITH_ERRORS", summary.status());
        assertThat(summary.targets()).extracting(TargetRunSummary::targetKey).containsExactly("omega", "rolex");
        TargetRunSummary omega = summary.targets().get(0);
        TargetRunSummary rolex = summary.targets().get(1);
        assertEquals(CrawlOrchestratorService.STATUS_SUCCESS, omega.status());
        assertEquals(CrawlOrchestratorService.STATUS_FAILED, rolex.status());
        assertEquals(TerminationReason.ERROR, rolex.run().terminatedReason());
        assertThat(rolex.error()).contains("browser crashed");
        verify(runLogRepository, times(2)).insert(anyString(), eq(DAY), eq("chrono24"), anyString(), anyString(), any(), any(), any());
        verify(saleDetectionService, times(1)).process(any(), any(), any());
    }

    @Test
    void incompleteCoverageIsReportedPerTarget() {
        ScrapeRunResult omegaRun = run("omega");
        ScrapeRunResult rolexRun = run("rolex");
        when(targetCrawlerService.crawl(any(), eq("omega"), any())).thenReturn(new TargetCrawlOutcome(omegaRun, List.of()));
        when(targetCrawlerService.crawl(any(), eq("rolex"), any())).thenReturn(new TargetCrawlOutcome(rolexRun, List.of()));
        when(saleDetectionService.process(eq(omegaRun), any(), eq(DAY))).thenReturn(detection("omega", false));
        when(saleDetectionService.process(eq(rolexRun), any(), eq(DAY))).thenReturn(detection("rolex", true));

        CrawlRunSummary summary = service().run(new CrawlRunRequest(List.of(), null, DAY));

        assertEquals("COMPLETED_WITH_ERRORS", summary.status());
        assertEquals(CrawlOrchestratorService.STATUS_INCOMPLETE, summary.targets().get(1).status());
    }

    @Test
    void explicitPageLimitIsPassedToEveryTarget() {
        ScrapeRunResult omegaRun = run("omega");
        ScrapeRunResult rolexRun = run("rolex");
        when(targetCrawlerService.crawl(any(), eq("omega"), eq(3))).thenReturn(new TargetCrawlOutcome(omegaRun, List.of()));
        when(targetCrawlerService.crawl(any(), eq("rolex"), eq(3))).thenReturn(new TargetCrawlOutcome(rolexRun, List.of()));
        when(saleDetectionService.process(any(), any(), eq(DAY))).thenAnswer(invocation -> {
            ScrapeRunResult run = invocation.getArgument(0);
            return detection(run.targetKey(), false);
        });

        CrawlRunSummary summary = service().run(new CrawlRunRequest(List.of("chrono24"), 3, DAY));

        assertEquals("COMPLETED", summary.status());
        verify(targetCrawlerService).crawl(any(), eq("omega"), eq(3));
        verify(targetCrawlerService).crawl(any(), eq("rolex"), eq(3));
    }

    @Test
    void unknownPlatformIsReportedWithoutCrawling() {
        CrawlRunSummary summary = service().run(new CrawlRunRequest(List.of("ebay"), null, DAY));

        assertEquals("COMPLETED_WITH_ERRORS", summary.status());
        assertEquals(1, summary.targets().size());
        assertEquals(ReasonCodes.UNKNOWN_PLATFORM, summary.targets().get(0).error());
        verify(targetCrawlerService, never()).crawl(any(), anyString(), any());
    }

    @Test
    void secondRunIsRejectedWhileOneIsActive() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        properties.platform("chrono24").setTargets(List.of("omega"));
        ScrapeRunResult omegaRun = run("omega");
        when(targetCrawlerService.crawl(any(), eq("omega"), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new TargetCrawlOutcome(omegaRun, List.of());
        });
        when(saleDetectionService.process(any(), any(), any())).thenReturn(detection("omega", false));
        CrawlOrchestratorService service = service();

        String runId = service.startAsync(new CrawlRunRequest(List.of(), null, DAY));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertThat(runId).isNotBlank();
        assertTrue(service.isActive());
        assertThrows(ActiveCrawlRunException.class, () -> service.run(new CrawlRunRequest(List.of(), null, DAY)));

        release.countDown();
        runExecutor.shutdown();
        assertTrue(runExecutor.awaitTermination(5, TimeUnit.SECONDS));
        assertThat(service.isActive()).isFalse();
        assertThat(service.latest()).isPresent();
        assertEquals("COMPLETED", service.latest().get().status());
    }

    private CrawlOrchestratorService service() {
        return new CrawlOrchestratorService(
            new PlatformRegistry(properties, new ObjectMapper()),
            targetCrawlerService,
            saleDetectionService,
            runLogRepository,
            snapshotStore,
            executor,
            runExecutor,
            properties
        );
    }

    private static ScrapeRunResult run(String target) {
        Instant now = Instant.now();
        return new ScrapeRunResult(
            "chrono24", target, 2, 2, 2, 240, 200, 0, 210, 0, List.of(), TerminationReason.NO_MORE_PAGES, now, now
        );
    }

    private static TargetDetectionResult detection(String target, boolean incomplete) {
        CoverageDecision coverage = incomplete
            ? CoverageDecision.invalid(CoverageDecision.INCONSISTENT_WITH_PRIOR_RUN)
            : CoverageDecision.accept();
        return new TargetDetectionResult("chrono24", target, DAY, coverage, false, incomplete, 200, 1, 2, 0, 1, List.of());
    }
}
