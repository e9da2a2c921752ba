package com.delta.listingtracker.crawl.model;

public enum NavigationOutcome {
    LISTINGS_FOUND,
    EMPTY,
    BLOCKED,
    CHALLENGE,
    NO_CONTROL,
    ERROR,
    RESOLVER_FAILED
}
