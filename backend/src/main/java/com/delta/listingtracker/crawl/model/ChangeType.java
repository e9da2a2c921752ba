package com.delta.listingtracker.crawl.model;

public enum ChangeType {
    SOLD,
    NEW,
    UPDATED
}
