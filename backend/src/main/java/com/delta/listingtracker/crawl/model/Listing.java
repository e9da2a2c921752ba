package com.delta.listingtracker.crawl.model;

import java.math.BigDecimal;

public record Listing(
    String platform,
    String listingId,
    String title,
    BigDecimal price,
    String currency,
    String condition,
    String country,
    String imageUrl,
    String url,
    int seenAtPage
) {
    public ListingKey key() {
        return new ListingKey(platform, listingId);
    }

    public boolean samePrice(Listing other) {
        if (other == null) {
            return false;
        }
        if (price == null || other.price() == null) {
            return price == null && other.price() == null;
        }
        return price.compareTo(other.price()) == 0;
    }
}
