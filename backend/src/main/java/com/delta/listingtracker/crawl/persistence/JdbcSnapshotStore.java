package com.delta.listingtracker.crawl.persistence;

import com.delta.listingtracker.crawl.model.ChangeType;
import com.delta.listingtracker.crawl.model.DetectedSale;
import com.delta.listingtracker.crawl.model.InventorySnapshot;
import com.delta.listingtracker.crawl.model.Listing;
import com.delta.listingtracker.crawl.model.ListingKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Repository
public class JdbcSnapshotStore implements SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcSnapshotStore.class);

    private static final RowMapper<DetectedSale> SALE_MAPPER = (rs, rowNum) -> new DetectedSale(
        rs.getString("platform"),
        rs.getString("listing_id"),
        rs.getString("target_key"),
        rs.getObject("detection_date", LocalDate.class),
        rs.getBigDecimal("last_seen_price"),
        rs.getString("currency"),
        rs.getObject("days_listed", Integer.class),
        ChangeType.valueOf(rs.getString("classification")),
        rs.getString("title"),
        rs.getString("url")
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public JdbcSnapshotStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    @Override
    public void saveSnapshot(InventorySnapshot snapshot) {
        jdbc.update(
            """
                DELETE FROM daily_inventory
                WHERE platform = :platform
                  AND target_key = :targetKey
                  AND snapshot_date = :snapshotDate
                """,
            new MapSqlParameterSource()
                .addValue("platform", snapshot.platform())
                .addValue("targetKey", snapshot.targetKey())
                .addValue("snapshotDate", snapshot.snapshotDate())
        );
        if (snapshot.isEmpty()) {
            return;
        }
        String sql = postgres
            ? """
                INSERT INTO daily_inventory (
                    platform, listing_id, target_key, snapshot_date, title, price, currency,
                    item_condition, country, image_url, url, seen_at_page
                )
                VALUES (
                    :platform, :listingId, :targetKey, :snapshotDate, :title, :price, :currency,
                    :condition, :country, :imageUrl, :url, :seenAtPage
                )
                ON CONFLICT (platform, listing_id, snapshot_date)
                DO UPDATE SET
                    target_key = EXCLUDED.target_key,
                    title = EXCLUDED.title,
                    price = EXCLUDED.price,
                    currency = EXCLUDED.currency,
                    item_condition = EXCLUDED.item_condition,
                    country = EXCLUDED.country,
                    image_url = EXCLUDED.image_url,
                    url = EXCLUDED.url,
                    seen_at_page = EXCLUDED.seen_at_page
                """
            : """
                MERGE INTO daily_inventory (
                    platform, listing_id, target_key, snapshot_date, title, price, currency,
                    item_condition, country, image_url, url, seen_at_page
                )
                KEY (platform, listing_id, snapshot_date)
                VALUES (
                    :platform, :listingId, :targetKey, :snapshotDate, :title, :price, :currency,
                    :condition, :country, :imageUrl, :url, :seenAtPage
                )
                """;
        List<MapSqlParameterSource> batch = new ArrayList<>();
        for (Listing listing : snapshot.listings()) {
            batch.add(new MapSqlParameterSource()
                .addValue("platform", listing.platform())
                .addValue("listingId", listing.listingId())
                .addValue("targetKey", snapshot.targetKey())
                .addValue("snapshotDate", snapshot.snapshotDate())
                .addValue("title", listing.title())
                .addValue("price", listing.price())
                .addValue("currency", listing.currency())
                .addValue("condition", listing.condition())
                .addValue("country", listing.country())
                .addValue("imageUrl", listing.imageUrl())
                .addValue("url", listing.url())
                .addValue("seenAtPage", listing.seenAtPage()));
        }
        jdbc.batchUpdate(sql, batch.toArray(new MapSqlParameterSource[0]));
        log.debug("Stored {} rows for {} '{}' on {}", batch.size(), snapshot.platform(), snapshot.targetKey(), snapshot.snapshotDate());
    }

    @Override
    public InventorySnapshot getSnapshot(String platform, String targetKey, LocalDate date) {
        List<Listing> listings = jdbc.query(
            """
                SELECT platform, listing_id, title, price, currency, item_condition, country, image_url, url, seen_at_page
                FROM daily_inventory
                WHERE platform = :platform
                  AND target_key = :targetKey
                  AND snapshot_date = :snapshotDate
                ORDER BY seen_at_page, id
                """,
            new MapSqlParameterSource()
                .addValue("platform", platform)
                .addValue("targetKey", targetKey)
                .addValue("snapshotDate", date),
            (rs, rowNum) -> new Listing(
                rs.getString("platform"),
                rs.getString("listing_id"),
                rs.getString("title"),
                rs.getBigDecimal("price"),
                rs.getString("currency"),
                rs.getString("item_condition"),
                rs.getString("country"),
                rs.getString("image_url"),
                rs.getString("url"),
                rs.getInt("seen_at_page")
            )
        );
        return new InventorySnapshot(platform, targetKey, date, listings);
    }

    @Override
    public int countSnapshot(String platform, String targetKey, LocalDate date) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM daily_inventory
                WHERE platform = :platform
                  AND target_key = :targetKey
                  AND snapshot_date = :snapshotDate
                """,
            new MapSqlParameterSource()
                .addValue("platform", platform)
                .addValue("targetKey", targetKey)
                .addValue("snapshotDate", date),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    @Override
    public boolean saveDetectedSale(DetectedSale sale) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("platform", sale.platform())
            .addValue("listingId", sale.listingId())
            .addValue("targetKey", sale.targetKey())
            .addValue("detectionDate", sale.detectionDate())
            .addValue("lastSeenPrice", sale.lastSeenPrice())
            .addValue("currency", sale.currency())
            .addValue("daysListed", sale.daysListed())
            .addValue("classification", sale.classification().name())
            .addValue("title", sale.title())
            .addValue("url", sale.url());
        String insert = """
            INSERT INTO detected_sales (
                platform, listing_id, target_key, detection_date, last_seen_price, currency,
                days_listed, classification, title, url
            )
            VALUES (
                :platform, :listingId, :targetKey, :detectionDate, :lastSeenPrice, :currency,
                :daysListed, :classification, :title, :url
            )
            """;
        if (postgres) {
            int rows = jdbc.update(insert + " ON CONFLICT (platform, listing_id, detection_date) DO NOTHING", params);
            return rows > 0;
        }
        try {
            return jdbc.update(insert, params) > 0;
        } catch (DuplicateKeyException e) {
            log.debug("Sale already recorded for {} {} on {}", sale.platform(), sale.listingId(), sale.detectionDate());
            return false;
        }
    }

    @Override
    public List<DetectedSale> findDetectedSales(LocalDate from, LocalDate to, String platform) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("from", from)
            .addValue("to", to);
        StringBuilder sql = new StringBuilder("""
            SELECT platform, listing_id, target_key, detection_date, last_seen_price, currency,
                   days_listed, classification, title, url
            FROM detected_sales
            WHERE detection_date >= :from
              AND detection_date <= :to
            """);
        if (platform != null && !platform.isBlank()) {
            sql.append(" AND platform = :platform");
            params.addValue("platform", platform.trim().toLowerCase(Locale.ROOT));
        }
        sql.append(" ORDER BY detection_date DESC, platform, listing_id");
        return jdbc.query(sql.toString(), params, SALE_MAPPER);
    }

    @Override
    public void recordSightings(Collection<Listing> listings, LocalDate date) {
        for (Listing listing : listings) {
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("platform", listing.platform())
                .addValue("listingId", listing.listingId())
                .addValue("seenDate", date)
                .addValue("price", listing.price())
                .addValue("currency", listing.currency());
            if (postgres) {
                jdbc.update(
                    """
                        INSERT INTO listing_tracking (platform, listing_id, first_seen_date, last_seen_date, current_price, currency)
                        VALUES (:platform, :listingId, :seenDate, :seenDate, :price, :currency)
                        ON CONFLICT (platform, listing_id)
                        DO UPDATE SET
                            first_seen_date = LEAST(listing_tracking.first_seen_date, EXCLUDED.first_seen_date),
                            last_seen_date = GREATEST(listing_tracking.last_seen_date, EXCLUDED.last_seen_date)
                        """,
                    params
                );
                continue;
            }
            int updated = jdbc.update(
                """
                    UPDATE listing_tracking
                    SET first_seen_date = CASE WHEN first_seen_date > :seenDate THEN :seenDate ELSE first_seen_date END,
                        last_seen_date = CASE WHEN last_seen_date < :seenDate THEN :seenDate ELSE last_seen_date END
                    WHERE platform = :platform
                      AND listing_id = :listingId
                    """,
                params
            );
            if (updated == 0) {
                jdbc.update(
                    """
                        INSERT INTO listing_tracking (platform, listing_id, first_seen_date, last_seen_date, current_price, currency)
                        VALUES (:platform, :listingId, :seenDate, :seenDate, :price, :currency)
                        """,
                    params
                );
            }
        }
    }

    @Override
    public Map<ListingKey, LocalDate> findFirstSeenDates(String platform, Collection<String> listingIds) {
        Map<ListingKey, LocalDate> out = new LinkedHashMap<>();
        if (listingIds == null || listingIds.isEmpty()) {
            return out;
        }
        jdbc.query(
            """
                SELECT listing_id, first_seen_date
                FROM listing_tracking
                WHERE platform = :platform
                  AND listing_id IN (:listingIds)
                """,
            new MapSqlParameterSource()
                .addValue("platform", platform)
                .addValue("listingIds", listingIds),
            rs -> {
                out.put(
                    new ListingKey(platform, rs.getString("listing_id")),
                    rs.getObject("first_seen_date", LocalDate.class)
                );
            }
        );
        return out;
    }

    @Override
    public void updateCurrentPrice(Listing listing) {
        jdbc.update(
            """
                UPDATE listing_tracking
                SET current_price = :price,
                    currency = :currency
                WHERE platform = :platform
                  AND listing_id = :listingId
                """,
            new MapSqlParameterSource()
                .addValue("platform", listing.platform())
                .addValue("listingId", listing.listingId())
                .addValue("price", listing.price())
                .addValue("currency", listing.currency())
        );
    }

    @Override
    public int deleteSnapshotsBefore(LocalDate cutoff) {
        return jdbc.update(
            "DELETE FROM daily_inventory WHERE snapshot_date < :cutoff",
            new MapSqlParameterSource("cutoff", cutoff)
        );
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to portable SQL", e);
            return false;
        }
    }
}
