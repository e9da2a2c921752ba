package com.delta.listingtracker.crawl.model;

import java.time.Instant;
import java.util.List;

public record CrawlRunSummary(
    String runId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    List<TargetRunSummary> targets) {}
