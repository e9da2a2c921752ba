package com.delta.listingtracker.crawl.model;

import java.time.Instant;
import java.util.List;

/**
 * Coverage metadata of one target crawl. Handed explicitly to coverage validation and sale
 * detection; nothing downstream recomputes or defaults these numbers.
 *
 * @param pagesTotalDetected pages advertised by the marketplace at pre-scan, {@code null} when unknown
 * @param itemsTotalDetected items advertised (or estimated from pages) at pre-scan, {@code null} when unknown
 * @param rawItemsExtracted sum of per-page extracted counts before cross-page deduplication
 */
public record ScrapeRunResult(
    String platform,
    String targetKey,
    int pagesAttempted,
    int pagesSucceeded,
    Integer pagesTotalDetected,
    Integer itemsTotalDetected,
    int itemsCollected,
    int itemsExcluded,
    int rawItemsExtracted,
    int consecutiveFailures,
    List<Integer> failedPages,
    TerminationReason terminatedReason,
    Instant startedAt,
    Instant finishedAt
) {
    public ScrapeRunResult {
        failedPages = failedPages == null ? List.of() : List.copyOf(failedPages);
    }

    public boolean pageCountsKnown() {
        return pagesTotalDetected != null && pagesTotalDetected > 0;
    }

    public Double pageCoverage() {
        if (!pageCountsKnown()) {
            return null;
        }
        return (double) pagesAttempted / pagesTotalDetected;
    }

    public boolean hadPageFailures() {
        return !failedPages.isEmpty();
    }
}
