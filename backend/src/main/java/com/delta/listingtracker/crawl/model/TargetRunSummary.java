package com.delta.listingtracker.crawl.model;

public record TargetRunSummary(
    String platform,
    String targetKey,
    String status,
    ScrapeRunResult run,
    TargetDetectionResult detection,
    String error
) {
}
