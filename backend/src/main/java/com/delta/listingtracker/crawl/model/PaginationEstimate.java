package com.delta.listingtracker.crawl.model;

public record PaginationEstimate(Integer totalPages, Integer totalItems) {
    public static PaginationEstimate unknown() {
        return new PaginationEstimate(null, null);
    }

    public boolean pagesKnown() {
        return totalPages != null && totalPages > 0;
    }
}
