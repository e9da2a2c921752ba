package com.delta.listingtracker.crawl.model;

import java.util.List;

public record DiffResult(List<ChangeEvent> events, List<DetectedSale> sales) {
    public DiffResult {
        events = events == null ? List.of() : List.copyOf(events);
        sales = sales == null ? List.of() : List.copyOf(sales);
    }

    public int count(ChangeType type) {
        int count = 0;
        for (ChangeEvent event : events) {
            if (event.type() == type) {
                count++;
            }
        }
        return count;
    }

    public List<ChangeEvent> ofType(ChangeType type) {
        return events.stream().filter(event -> event.type() == type).toList();
    }
}
