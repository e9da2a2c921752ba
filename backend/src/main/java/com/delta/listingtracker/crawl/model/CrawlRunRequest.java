package com.delta.listingtracker.crawl.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public record CrawlRunRequest(
    List<String> platforms,
    Integer maxPages,
    LocalDate snapshotDate
) {
    public List<String> normalizedPlatforms() {
        if (platforms == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String platform : platforms) {
            if (platform == null) {
                continue;
            }
            String normalized = platform.trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty() && !out.contains(normalized)) {
                out.add(normalized);
            }
        }
        return out;
    }
}
