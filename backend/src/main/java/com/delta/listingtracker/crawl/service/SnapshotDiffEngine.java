package com.delta.listingtracker.crawl.service;

import com.delta.listingtracker.crawl.model.ChangeEvent;
import com.delta.listingtracker.crawl.model.ChangeType;
import com.delta.listingtracker.crawl.model.DetectedSale;
import com.delta.listingtracker.crawl.model.DiffResult;
import com.delta.listingtracker.crawl.model.InventorySnapshot;
import com.delta.listingtracker.crawl.model.Listing;
import com.delta.listingtracker.crawl.model.ListingKey;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pure comparison of two snapshots of the same target. Callers only pass snapshots from a run
 * whose coverage was validated.
 */
@Component
public class SnapshotDiffEngine {

    public DiffResult diff(
        InventorySnapshot previous,
        InventorySnapshot current,
        LocalDate detectionDate,
        Map<ListingKey, LocalDate> firstSeenDates
    ) {
        Map<ListingKey, Listing> before = previous.byKey();
        Map<ListingKey, Listing> after = current.byKey();
        List<ChangeEvent> events = new ArrayList<>();
        List<DetectedSale> sales = new ArrayList<>();

        for (Map.Entry<ListingKey, Listing> entry : before.entrySet()) {
            if (after.containsKey(entry.getKey())) {
                continue;
            }
            Listing gone = entry.getValue();
            events.add(new ChangeEvent(ChangeType.SOLD, entry.getKey(), gone, null));
            LocalDate firstSeen = firstSeenDates == null ? null : firstSeenDates.get(entry.getKey());
            Integer daysListed = firstSeen == null ? null : (int) ChronoUnit.DAYS.between(firstSeen, detectionDate);
            sales.add(new DetectedSale(
                gone.platform(),
                gone.listingId(),
                current.targetKey(),
                detectionDate,
                gone.price(),
                gone.currency(),
                daysListed,
                ChangeType.SOLD,
                gone.title(),
                gone.url()
            ));
        }

        for (Map.Entry<ListingKey, Listing> entry : after.entrySet()) {
            Listing earlier = before.get(entry.getKey());
            if (earlier == null) {
                events.add(new ChangeEvent(ChangeType.NEW, entry.getKey(), null, entry.getValue()));
            } else if (!earlier.samePrice(entry.getValue())) {
                events.add(new ChangeEvent(ChangeType.UPDATED, entry.getKey(), earlier, entry.getValue()));
            }
        }
        return new DiffResult(events, sales);
    }
}
