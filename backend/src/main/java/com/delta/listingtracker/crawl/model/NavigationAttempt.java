package com.delta.listingtracker.crawl.model;

import com.delta.listingtracker.crawl.navigation.NavigationState;

public record NavigationAttempt(
    int pageNumber,
    NavigationState strategy,
    NavigationOutcome outcome,
    int itemsFound,
    String detail
) {
}
