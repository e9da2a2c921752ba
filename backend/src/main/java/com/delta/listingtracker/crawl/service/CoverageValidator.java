package com.delta.listingtracker.crawl.service;

import com.delta.listingtracker.config.CrawlerProperties;
import com.delta.listingtracker.crawl.model.CoverageDecision;
import com.delta.listingtracker.crawl.model.ScrapeRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a crawl saw enough of a target's inventory for disappearances to count as sales.
 * Rules run in order and the first failing rule wins.
 */
@Component
public class CoverageValidator {
    private static final Logger log = LoggerFactory.getLogger(CoverageValidator.class);

    private final CrawlerProperties.Coverage settings;

    public CoverageValidator(CrawlerProperties properties) {
        this.settings = properties.getCoverage();
    }

    /**
     * @param previousCount stored item count of the previous snapshot, {@code null} on a first run
     */
    public CoverageDecision validate(ScrapeRunResult run, Integer previousCount) {
        CoverageDecision decision = decide(run, previousCount);
        if (decision.valid()) {
            log.info("{} '{}': coverage valid ({} items)", run.platform(), run.targetKey(), run.itemsCollected());
        } else {
            log.warn(
                "{} '{}': coverage invalid, {} (items={}, pages {}/{}, previous={})",
                run.platform(),
                run.targetKey(),
                decision.reason(),
                run.itemsCollected(),
                run.pagesAttempted(),
                run.pagesTotalDetected(),
                previousCount
            );
        }
        return decision;
    }

    private CoverageDecision decide(ScrapeRunResult run, Integer previousCount) {
        int collected = run.itemsCollected();
        if (collected == 0 || collected < settings.getMinItemsFloor()) {
            return CoverageDecision.invalid(CoverageDecision.BELOW_MINIMUM_FLOOR);
        }
        Double pageCoverage = run.pageCoverage();
        if (pageCoverage != null && pageCoverage < settings.getMinPageCoverage()) {
            return CoverageDecision.invalid(CoverageDecision.INSUFFICIENT_PAGE_COVERAGE);
        }
        if (previousCount != null && previousCount > 0) {
            double changePercent = Math.abs(collected - previousCount) * 100.0 / previousCount;
            if (changePercent > settings.getMaxCountChangePercent() && !provablyComplete(run)) {
                return CoverageDecision.invalid(CoverageDecision.INCONSISTENT_WITH_PRIOR_RUN);
            }
        }
        return CoverageDecision.accept();
    }

    /**
     * Every advertised page was crawled without a failure, or the collected items match the
     * advertised total within the configured tolerance.
     */
    boolean provablyComplete(ScrapeRunResult run) {
        if (run.pageCountsKnown() && run.pagesAttempted() >= run.pagesTotalDetected() && !run.hadPageFailures()) {
            return true;
        }
        Integer advertised = run.itemsTotalDetected();
        if (advertised == null || advertised <= 0) {
            return false;
        }
        int seen = run.itemsCollected() + run.itemsExcluded();
        return Math.abs(seen - advertised) <= settings.getItemTolerance();
    }
}
