package com.delta.listingtracker.crawl.model;

public record CoverageDecision(boolean valid, String reason) {
    public static final String BELOW_MINIMUM_FLOOR = "below minimum floor";
    public static final String INSUFFICIENT_PAGE_COVERAGE = "insufficient page coverage";
    public static final String INCONSISTENT_WITH_PRIOR_RUN = "coverage inconsistent versus prior run";

    public static CoverageDecision accept() {
        return new CoverageDecision(true, null);
    }

    public static CoverageDecision invalid(String reason) {
        return new CoverageDecision(false, reason);
    }
}
