package com.delta.listingtracker.crawl.model;

public enum TerminationReason {
    NO_MORE_PAGES,
    PAGE_LIMIT_REACHED,
    CONSECUTIVE_FAILURE_LIMIT,
    ERROR
}
