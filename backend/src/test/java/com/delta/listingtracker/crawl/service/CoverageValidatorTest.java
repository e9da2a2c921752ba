package com.delta.listingtracker.crawl.service;

import com.delta.listingtracker.config.CrawlerProperties;
import com.delta.listingtracker.crawl.model.CoverageDecision;
import com.delta.listingtracker.crawl.model.ScrapeRunResult;
import com.delta.listingtracker.crawl.model.TerminationReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoverageValidatorTest {
    private CrawlerProperties properties;
    private CoverageValidator validator;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.getCoverage().setMinItemsFloor(1);
        validator = new CoverageValidator(properties);
    }

    @Test
    void lowPageCoverageIsInvalidEvenWhenCountsMatch() {
        ScrapeRunResult run = run(1, 50, null, 2, 0, List.of());

        CoverageDecision decision = validator.validate(run, 2);

        assertFalse(decision.valid());
        assertEquals(CoverageDecision.INSUFFICIENT_PAGE_COVERAGE, decision.reason());
    }

    @Test
    void emptyCrawlFailsFloorRegardlessOfConfiguration() {
        properties.getCoverage().setMinItemsFloor(0);

        CoverageDecision decision = validator.validate(run(1, 1, null, 0, 0, List.of()), null);

        assertEquals(CoverageDecision.BELOW_MINIMUM_FLOOR, decision.reason());
    }

    @Test
    void floorIsCheckedBeforePageCoverage() {
        properties.getCoverage().setMinItemsFloor(100);

        CoverageDecision decision = validator.validate(run(1, 50, null, 40, 0, List.of()), 40);

        assertEquals(CoverageDecision.BELOW_MINIMUM_FLOOR, decision.reason());
    }

    @Test
    void largeCountSwingIsInconsistentUnlessProvablyComplete() {
        ScrapeRunResult partial = run(8, 10, 1200, 600, 0, List.of(4, 5));

        CoverageDecision decision = validator.validate(partial, 1000);

        assertFalse(decision.valid());
        assertEquals(CoverageDecision.INCONSISTENT_WITH_PRIOR_RUN, decision.reason());
    }

    @Test
    void fullyCrawledTargetOverridesCountSwing() {
        ScrapeRunResult complete = run(10, 10, null, 600, 0, List.of());

        assertTrue(validator.validate(complete, 1000).valid());
    }

    @Test
    void advertisedTotalWithinToleranceOverridesCountSwing() {
        ScrapeRunResult run = run(8, 10, 700, 590, 20, List.of(9));

        assertTrue(validator.provablyComplete(run));
        assertTrue(validator.validate(run, 1000).valid());
    }

    @Test
    void smallSwingIsValid() {
        ScrapeRunResult run = run(3, 10, null, 950, 0, List.of());

        assertTrue(validator.validate(run, 1000).valid());
    }

    @Test
    void firstRunSkipsPriorComparison() {
        ScrapeRunResult run = run(5, 10, null, 300, 0, List.of(2));

        assertTrue(validator.validate(run, null).valid());
    }

    @Test
    void unknownPageTotalsSkipPageCoverageRule() {
        ScrapeRunResult run = run(1, null, null, 120, 0, List.of());

        assertTrue(validator.validate(run, 118).valid());
    }

    private static ScrapeRunResult run(
        int pagesAttempted,
        Integer pagesTotal,
        Integer itemsTotal,
        int collected,
        int excluded,
        List<Integer> failedPages
    ) {
        return new ScrapeRunResult(
            "chrono24",
            "omega",
            pagesAttempted,
            pagesAttempted - failedPages.size(),
            pagesTotal,
            itemsTotal,
            collected,
            excluded,
            collected + excluded,
            0,
            failedPages,
            TerminationReason.NO_MORE_PAGES,
            Instant.parse("2026-10-18T06:00:00Z"),
            Instant.parse("2026-10-18T06:30:00Z")
        );
    }
}
