package com.delta.listingtracker.crawl.persistence;

import com.delta.listingtracker.crawl.model.ScrapeRunLogEntry;
import com.delta.listingtracker.crawl.model.ScrapeRunResult;
import com.delta.listingtracker.crawl.model.TargetDetectionResult;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

@Repository
public class ScrapeRunLogRepository {
    private static final int MAX_ERROR_LENGTH = 2000;

    private final NamedParameterJdbcTemplate jdbc;

    public ScrapeRunLogRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insert(
        String runId,
        LocalDate runDate,
        String platform,
        String targetKey,
        String status,
        ScrapeRunResult run,
        TargetDetectionResult detection,
        String errorDetail
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("runDate", runDate)
            .addValue("platform", platform)
            .addValue("targetKey", targetKey)
            .addValue("status", status)
            .addValue("pagesAttempted", run == null ? 0 : run.pagesAttempted())
            .addValue("pagesTotalDetected", run == null ? null : run.pagesTotalDetected())
            .addValue("itemsTotalDetected", run == null ? null : run.itemsTotalDetected())
            .addValue("itemsCollected", run == null ? 0 : run.itemsCollected())
            .addValue("itemsExcluded", run == null ? 0 : run.itemsExcluded())
            .addValue("consecutiveFailures", run == null ? 0 : run.consecutiveFailures())
            .addValue("terminatedReason", run == null || run.terminatedReason() == null ? null : run.terminatedReason().name())
            .addValue("coverageValid", detection != null && detection.coverage() != null && detection.coverage().valid())
            .addValue("coverageReason", detection == null || detection.coverage() == null ? null : detection.coverage().reason())
            .addValue("salesRecorded", detection == null ? 0 : detection.salesRecorded())
            .addValue("errorDetail", truncate(errorDetail))
            .addValue("durationMs", run == null || run.startedAt() == null || run.finishedAt() == null
                ? null
                : Duration.between(run.startedAt(), run.finishedAt()).toMillis());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scrape_runs (
                    run_id, run_date, platform, target_key, status, pages_attempted, pages_total_detected,
                    items_total_detected, items_collected, items_excluded, consecutive_failures, terminated_reason,
                    coverage_valid, coverage_reason, sales_recorded, error_detail, duration_ms
                )
                VALUES (
                    :runId, :runDate, :platform, :targetKey, :status, :pagesAttempted, :pagesTotalDetected,
                    :itemsTotalDetected, :itemsCollected, :itemsExcluded, :consecutiveFailures, :terminatedReason,
                    :coverageValid, :coverageReason, :salesRecorded, :errorDetail, :durationMs
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? -1L : key.longValue();
    }

    public List<ScrapeRunLogEntry> findRecent(int days) {
        LocalDate since = LocalDate.now().minusDays(Math.max(0, days));
        return jdbc.query(
            """
                SELECT id, run_date, platform, target_key, status, pages_attempted, pages_total_detected,
                       items_collected, consecutive_failures, terminated_reason, coverage_valid, coverage_reason,
                       sales_recorded, created_at
                FROM scrape_runs
                WHERE run_date >= :since
                ORDER BY created_at DESC, id DESC
                """,
            new MapSqlParameterSource("since", since),
            (rs, rowNum) -> {
                Timestamp createdAt = rs.getTimestamp("created_at");
                return new ScrapeRunLogEntry(
                    rs.getLong("id"),
                    rs.getObject("run_date", LocalDate.class),
                    rs.getString("platform"),
                    rs.getString("target_key"),
                    rs.getString("status"),
                    rs.getInt("pages_attempted"),
                    rs.getObject("pages_total_detected", Integer.class),
                    rs.getInt("items_collected"),
                    rs.getInt("consecutive_failures"),
                    rs.getString("terminated_reason"),
                    rs.getBoolean("coverage_valid"),
                    rs.getString("coverage_reason"),
                    rs.getInt("sales_recorded"),
                    createdAt == null ? null : createdAt.toInstant()
                );
            }
        );
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
