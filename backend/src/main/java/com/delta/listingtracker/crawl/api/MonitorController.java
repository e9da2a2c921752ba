package com.delta.listingtracker.crawl.api;

import com.delta.listingtracker.crawl.model.CrawlRunRequest;
import com.delta.listingtracker.crawl.model.CrawlRunSummary;
import com.delta.listingtracker.crawl.model.DetectedSale;
import com.delta.listingtracker.crawl.model.ScrapeRunLogEntry;
import com.delta.listingtracker.crawl.persistence.ScrapeRunLogRepository;
import com.delta.listingtracker.crawl.persistence.SnapshotStore;
import com.delta.listingtracker.crawl.service.CrawlOrchestratorService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class MonitorController {
    private static final int MAX_RUN_DAYS = 365;

    private final CrawlOrchestratorService crawlOrchestratorService;
    private final SnapshotStore snapshotStore;
    private final ScrapeRunLogRepository runLogRepository;

    public MonitorController(
        CrawlOrchestratorService crawlOrchestratorService,
        SnapshotStore snapshotStore,
        ScrapeRunLogRepository runLogRepository
    ) {
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.snapshotStore = snapshotStore;
        this.runLogRepository = runLogRepository;
    }

    @PostMapping("/crawl/run")
    public ResponseEntity<Map<String, String>> startRun(@RequestBody(required = false) CrawlRunRequest request) {
        CrawlRunRequest safeRequest = request == null ? new CrawlRunRequest(List.of(), null, null) : request;
        if (safeRequest.maxPages() != null && safeRequest.maxPages() < 0) {
            throw new IllegalArgumentException("maxPages must be >= 0");
        }
        String runId = crawlOrchestratorService.startAsync(safeRequest);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("runId", runId, "status", "started"));
    }

    @GetMapping("/crawl/runs/latest")
    public ResponseEntity<CrawlRunSummary> latestRun() {
        return crawlOrchestratorService.latest()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/sales")
    public List<DetectedSale> sales(
        @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
        @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
        @RequestParam(name = "platform", required = false) String platform
    ) {
        LocalDate safeTo = to == null ? LocalDate.now() : to;
        LocalDate safeFrom = from == null ? safeTo.minusDays(7) : from;
        if (safeFrom.isAfter(safeTo)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        return snapshotStore.findDetectedSales(safeFrom, safeTo, platform);
    }

    @GetMapping("/runs/recent")
    public List<ScrapeRunLogEntry> recentRuns(@RequestParam(name = "days", defaultValue = "7") int days) {
        return runLogRepository.findRecent(Math.max(0, Math.min(MAX_RUN_DAYS, days)));
    }
}
