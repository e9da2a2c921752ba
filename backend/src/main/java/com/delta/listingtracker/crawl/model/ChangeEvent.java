package com.delta.listingtracker.crawl.model;

import java.math.BigDecimal;

public record ChangeEvent(
    ChangeType type,
    ListingKey key,
    Listing previous,
    Listing current
) {
    public BigDecimal priceChange() {
        if (previous == null || current == null || previous.price() == null || current.price() == null) {
            return null;
        }
        return current.price().subtract(previous.price());
    }
}
