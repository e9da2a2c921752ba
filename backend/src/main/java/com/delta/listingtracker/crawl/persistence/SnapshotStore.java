package com.delta.listingtracker.crawl.persistence;

import com.delta.listingtracker.crawl.model.DetectedSale;
import com.delta.listingtracker.crawl.model.InventorySnapshot;
import com.delta.listingtracker.crawl.model.Listing;
import com.delta.listingtracker.crawl.model.ListingKey;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface SnapshotStore {

    /**
     * Stores the snapshot, replacing whatever the same target stored for that day.
     */
    void saveSnapshot(InventorySnapshot snapshot);

    InventorySnapshot getSnapshot(String platform, String targetKey, LocalDate date);

    int countSnapshot(String platform, String targetKey, LocalDate date);

    /**
     * @return false when a sale for the same platform, listing and day already exists
     */
    boolean saveDetectedSale(DetectedSale sale);

    List<DetectedSale> findDetectedSales(LocalDate from, LocalDate to, String platform);

    void recordSightings(Collection<Listing> listings, LocalDate date);

    Map<ListingKey, LocalDate> findFirstSeenDates(String platform, Collection<String> listingIds);

    void updateCurrentPrice(Listing listing);

    int deleteSnapshotsBefore(LocalDate cutoff);
}
