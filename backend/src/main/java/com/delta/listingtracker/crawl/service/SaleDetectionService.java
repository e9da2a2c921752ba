package com.delta.listingtracker.crawl.service;

import com.delta.listingtracker.crawl.model.ChangeEvent;
import com.delta.listingtracker.crawl.model.ChangeType;
import com.delta.listingtracker.crawl.model.CoverageDecision;
import com.delta.listingtracker.crawl.model.DetectedSale;
import com.delta.listingtracker.crawl.model.DiffResult;
import com.delta.listingtracker.crawl.model.InventorySnapshot;
import com.delta.listingtracker.crawl.model.Listing;
import com.delta.listingtracker.crawl.model.ListingKey;
import com.delta.listingtracker.crawl.model.ScrapeRunResult;
import com.delta.listingtracker.crawl.model.TargetDetectionResult;
import com.delta.listingtracker.crawl.persistence.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Persists a target's daily snapshot and, when coverage holds up, turns disappearances since the
 * previous day into detected sales.
 */
@Service
public class SaleDetectionService {
    private static final Logger log = LoggerFactory.getLogger(SaleDetectionService.class);

    private final SnapshotStore store;
    private final CoverageValidator coverageValidator;
    private final SnapshotDiffEngine diffEngine;

    public SaleDetectionService(SnapshotStore store, CoverageValidator coverageValidator, SnapshotDiffEngine diffEngine) {
        this.store = store;
        this.coverageValidator = coverageValidator;
        this.diffEngine = diffEngine;
    }

    /**
     * @param run coverage metadata produced by the crawl of this target; never recomputed here
     * @param listings deduplicated listings of the crawl
     * @param snapshotDate calendar day of the snapshot; the previous snapshot is the day before
     */
    @Transactional
    public TargetDetectionResult process(ScrapeRunResult run, List<Listing> listings, LocalDate snapshotDate) {
        String platform = run.platform();
        String targetKey = run.targetKey();
        InventorySnapshot current = new InventorySnapshot(platform, targetKey, snapshotDate, listings);
        LocalDate previousDate = snapshotDate.minusDays(1);
        int previousCount = store.countSnapshot(platform, targetKey, previousDate);
        boolean firstRun = previousCount == 0;

        CoverageDecision coverage = coverageValidator.validate(run, firstRun ? null : previousCount);

        if (!current.isEmpty()) {
            store.saveSnapshot(current);
            store.recordSightings(current.listings(), snapshotDate);
        }

        if (!coverage.valid()) {
            log.warn(
                "{} '{}' {}: scraper incomplete ({}), snapshot kept, no sales recorded",
                platform,
                targetKey,
                snapshotDate,
                coverage.reason()
            );
            return new TargetDetectionResult(
                platform, targetKey, snapshotDate, coverage, firstRun, true, current.size(), 0, 0, 0, 0, List.of()
            );
        }

        if (firstRun) {
            List<ChangeEvent> events = new ArrayList<>();
            for (Map.Entry<ListingKey, Listing> entry : current.byKey().entrySet()) {
                events.add(new ChangeEvent(ChangeType.NEW, entry.getKey(), null, entry.getValue()));
            }
            log.info("{} '{}' {}: first run, {} listings recorded as baseline", platform, targetKey, snapshotDate, events.size());
            return new TargetDetectionResult(
                platform, targetKey, snapshotDate, coverage, true, false, current.size(), 0, events.size(), 0, 0, events
            );
        }

        InventorySnapshot previous = store.getSnapshot(platform, targetKey, previousDate);
        List<String> previousIds = previous.listings().stream().map(Listing::listingId).toList();
        Map<ListingKey, LocalDate> firstSeen = store.findFirstSeenDates(platform, previousIds);
        DiffResult diff = diffEngine.diff(previous, current, snapshotDate, firstSeen);

        int recorded = 0;
        for (DetectedSale sale : diff.sales()) {
            if (store.saveDetectedSale(sale)) {
                recorded++;
            }
        }
        for (ChangeEvent event : diff.ofType(ChangeType.UPDATED)) {
            store.updateCurrentPrice(event.current());
        }
        log.info(
            "{} '{}' {}: sold={} new={} updated={} salesRecorded={}",
            platform,
            targetKey,
            snapshotDate,
            diff.count(ChangeType.SOLD),
            diff.count(ChangeType.NEW),
            diff.count(ChangeType.UPDATED),
            recorded
        );
        return new TargetDetectionResult(
            platform,
            targetKey,
            snapshotDate,
            coverage,
            false,
            false,
            current.size(),
            diff.count(ChangeType.SOLD),
            diff.count(ChangeType.NEW),
            diff.count(ChangeType.UPDATED),
            recorded,
            diff.events()
        );
    }
}
