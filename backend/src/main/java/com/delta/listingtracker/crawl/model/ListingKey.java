package com.delta.listingtracker.crawl.model;

public record ListingKey(String platform, String listingId) {
}
