package com.delta.listingtracker.crawl.model;

import java.util.List;

public record TargetCrawlOutcome(ScrapeRunResult result, List<Listing> listings) {
    public TargetCrawlOutcome {
        listings = listings == null ? List.of() : List.copyOf(listings);
    }
}
