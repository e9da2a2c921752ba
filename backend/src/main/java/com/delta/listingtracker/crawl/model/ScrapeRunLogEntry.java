package com.delta.listingtracker.crawl.model;

import java.time.Instant;
import java.time.LocalDate;

public record ScrapeRunLogEntry(
    long id,
    LocalDate runDate,
    String platform,
    String targetKey,
    String status,
    int pagesAttempted,
    Integer pagesTotalDetected,
    int itemsCollected,
    int consecutiveFailures,
    String terminatedReason,
    boolean coverageValid,
    String coverageReason,
    int salesRecorded,
    Instant createdAt
) {
}
