package com.delta.listingtracker.crawl.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record InventorySnapshot(
    String platform,
    String targetKey,
    LocalDate snapshotDate,
    List<Listing> listings
) {
    public InventorySnapshot {
        listings = listings == null ? List.of() : List.copyOf(listings);
    }

    public boolean isEmpty() {
        return listings.isEmpty();
    }

    public int size() {
        return listings.size();
    }

    public Map<ListingKey, Listing> byKey() {
        Map<ListingKey, Listing> out = new LinkedHashMap<>();
        for (Listing listing : listings) {
            out.putIfAbsent(listing.key(), listing);
        }
        return Collections.unmodifiableMap(out);
    }
}
