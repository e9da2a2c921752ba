package com.delta.listingtracker.crawl.model;

import java.time.LocalDate;
import java.util.List;

public record TargetDetectionResult(
    String platform,
    String targetKey,
    LocalDate snapshotDate,
    CoverageDecision coverage,
    boolean firstRun,
    boolean scraperIncomplete,
    int itemsScraped,
    int soldCount,
    int newCount,
    int updatedCount,
    int salesRecorded,
    List<ChangeEvent> events
) {
    public TargetDetectionResult {
        events = events == null ? List.of() : List.copyOf(events);
    }
}
