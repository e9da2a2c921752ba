package com.delta.listingtracker.crawl.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DetectedSale(
    String platform,
    String listingId,
    String targetKey,
    LocalDate detectionDate,
    BigDecimal lastSeenPrice,
    String currency,
    Integer daysListed,
    ChangeType classification,
    String title,
    String url
) {
}
