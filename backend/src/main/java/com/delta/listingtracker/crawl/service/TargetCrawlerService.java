package com.delta.listingtracker.crawl.service;

import com.delta.listingtracker.config.CrawlerProperties;
import com.delta.listingtracker.crawl.model.Listing;
import com.delta.listingtracker.crawl.model.ListingKey;
import com.delta.listingtracker.crawl.model.PageNavigationResult;
import com.delta.listingtracker.crawl.model.PageSnapshot;
import com.delta.listingtracker.crawl.model.PaginationEstimate;
import com.delta.listingtracker.crawl.model.ResolverSolution;
import com.delta.listingtracker.crawl.model.ScrapeRunResult;
import com.delta.listingtracker.crawl.model.TargetCrawlOutcome;
import com.delta.listingtracker.crawl.model.TerminationReason;
import com.delta.listingtracker.crawl.navigation.PageNavigator;
import com.delta.listingtracker.crawl.platform.MarketplacePlatform;
import com.delta.listingtracker.crawl.render.NavigationException;
import com.delta.listingtracker.crawl.render.RenderSession;
import com.delta.listingtracker.crawl.render.RenderSessionFactory;
import com.delta.listingtracker.crawl.resolver.ChallengeResolver;
import com.delta.listingtracker.crawl.resolver.ResolverException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Crawls every page of one target through the {@link PageNavigator}, deduplicating listings
 * across pages and stopping early after too many consecutive page failures.
 */
@Service
public class TargetCrawlerService {
    private static final Logger log = LoggerFactory.getLogger(TargetCrawlerService.class);

    private final PageNavigator navigator;
    private final RenderSessionFactory sessionFactory;
    private final ChallengeResolver resolver;
    private final CrawlerProperties properties;

    public TargetCrawlerService(
        PageNavigator navigator,
        RenderSessionFactory sessionFactory,
        ChallengeResolver resolver,
        CrawlerProperties properties
    ) {
        this.navigator = navigator;
        this.sessionFactory = sessionFactory;
        this.resolver = resolver;
        this.properties = properties;
    }

    /**
     * @param maxPagesOverride explicit page limit for this run, {@code null} to use configuration
     */
    public TargetCrawlOutcome crawl(MarketplacePlatform platform, String target, Integer maxPagesOverride) {
        try (RenderSession session = sessionFactory.open()) {
            return crawl(session, platform, target, maxPagesOverride);
        }
    }

    TargetCrawlOutcome crawl(RenderSession session, MarketplacePlatform platform, String target, Integer maxPagesOverride) {
        Instant startedAt = Instant.now();
        CrawlerProperties.Pagination pagination = properties.getPagination();
        CrawlerProperties.Platform platformSettings = properties.platform(platform.name());

        String searchUrl = platform.searchUrl(target);
        Prescan prescan = prescan(session, platform, searchUrl);
        PaginationEstimate estimate = prescan.estimate();
        int requestedPages = requestedPages(maxPagesOverride, platformSettings, pagination);
        int pageLimit = pageLimit(estimate, requestedPages, pagination.getHardPageCap());
        log.info(
            "{} '{}': pre-scan pages={} items={}, crawling up to {} pages",
            platform.name(),
            target,
            estimate.totalPages(),
            estimate.totalItems(),
            pageLimit
        );

        Map<ListingKey, Listing> collected = new LinkedHashMap<>();
        Set<ListingKey> excluded = new HashSet<>();
        List<Integer> failedPages = new ArrayList<>();
        int pagesAttempted = 0;
        int pagesSucceeded = 0;
        int rawItems = 0;
        int consecutiveFailures = 0;
        TerminationReason terminated = null;

        for (int page = 1; page <= pageLimit; page++) {
            if (page > 1 && !pause(pagination)) {
                terminated = TerminationReason.ERROR;
                break;
            }
            String pageUrl = platform.pageUrl(prescan.landedUrl(), page);
            String previousUrl = page > 1 ? platform.pageUrl(prescan.landedUrl(), page - 1) : null;
            PageNavigationResult result = navigator.navigate(session, platform, page, pageUrl, previousUrl);
            for (int retry = 1; retry <= pagination.getPageRetries() && !result.succeeded(); retry++) {
                log.info("{} '{}' page {}: retry {} of {}", platform.name(), target, page, retry, pagination.getPageRetries());
                result = navigator.navigate(session, platform, page, pageUrl, previousUrl);
            }
            pagesAttempted++;

            if (!result.succeeded()) {
                failedPages.add(page);
                consecutiveFailures++;
                log.warn(
                    "{} '{}' page {} failed ({} consecutive)",
                    platform.name(),
                    target,
                    page,
                    consecutiveFailures
                );
                if (consecutiveFailures >= pagination.getConsecutiveFailureLimit()) {
                    terminated = TerminationReason.CONSECUTIVE_FAILURE_LIMIT;
                    log.warn(
                        "{} '{}': stopping after {} consecutive page failures at page {}",
                        platform.name(),
                        target,
                        consecutiveFailures,
                        page
                    );
                    break;
                }
                continue;
            }

            pagesSucceeded++;
            consecutiveFailures = 0;
            rawItems += result.listings().size();
            int added = 0;
            for (Listing listing : result.listings()) {
                if (isExcluded(listing, platformSettings.getExcludedCountries())) {
                    excluded.add(listing.key());
                    continue;
                }
                if (collected.putIfAbsent(listing.key(), listing) == null) {
                    added++;
                }
            }
            log.info(
                "{} '{}' page {}: extracted={} new={} accumulated={}",
                platform.name(),
                target,
                page,
                result.listings().size(),
                added,
                collected.size()
            );

            if (!estimate.pagesKnown() && !hasNextPage(session, platform, target, page)) {
                terminated = TerminationReason.NO_MORE_PAGES;
                break;
            }
        }

        if (terminated == null) {
            terminated = limitReason(estimate, requestedPages, pageLimit, pagination.getHardPageCap());
        }
        excluded.removeAll(collected.keySet());

        ScrapeRunResult run = new ScrapeRunResult(
            platform.name(),
            target,
            pagesAttempted,
            pagesSucceeded,
            estimate.totalPages(),
            estimate.totalItems(),
            collected.size(),
            excluded.size(),
            rawItems,
            consecutiveFailures,
            failedPages,
            terminated,
            startedAt,
            Instant.now()
        );
        log.info(
            "{} '{}': finished ({}) pages {}/{} items={} excluded={} raw={}",
            platform.name(),
            target,
            terminated,
            pagesAttempted,
            estimate.totalPages(),
            collected.size(),
            excluded.size(),
            rawItems
        );
        return new TargetCrawlOutcome(run, new ArrayList<>(collected.values()));
    }

    private Prescan prescan(RenderSession session, MarketplacePlatform platform, String searchUrl) {
        try {
            PageSnapshot snapshot = session.navigate(searchUrl);
            navigator.dismissOverlays(session, platform);
            if ((snapshot.blocked() || hasChallenge(session, platform)) && resolver.isEnabled()) {
                unlock(session, platform, searchUrl);
            }
            platform.pageSizeSelector().ifPresent(selector -> {
                if (session.click(selector)) {
                    log.debug("{}: selected page size via {}", platform.name(), selector);
                }
            });
            String landedUrl = session.currentUrl() == null || session.currentUrl().isBlank() ? searchUrl : session.currentUrl();
            return new Prescan(landedUrl, platform.estimatePagination(currentDocument(session)));
        } catch (NavigationException e) {
            log.warn("{}: pre-scan failed for {} ({}), totals unknown", platform.name(), searchUrl, e.getMessage());
            return new Prescan(searchUrl, PaginationEstimate.unknown());
        }
    }

    private void unlock(RenderSession session, MarketplacePlatform platform, String searchUrl) {
        try {
            ResolverSolution solution = resolver.resolve(searchUrl, Duration.ofSeconds(properties.getResolver().getTimeoutSeconds()));
            session.addCookies(solution.cookies(), solution.userAgent());
            session.navigate(searchUrl);
            navigator.dismissOverlays(session, platform);
        } catch (ResolverException e) {
            log.warn("{}: resolver could not unlock search page: {}", platform.name(), e.getMessage());
        }
    }

    private boolean hasChallenge(RenderSession session, MarketplacePlatform platform) {
        for (String selector : platform.challengeSelectors()) {
            if (session.exists(selector)) {
                return true;
            }
        }
        return false;
    }

    private boolean hasNextPage(RenderSession session, MarketplacePlatform platform, String target, int page) {
        try {
            return platform.hasNextPage(currentDocument(session));
        } catch (NavigationException e) {
            log.warn("{} '{}': unable to read pagination after page {} ({}), stopping", platform.name(), target, page, e.getMessage());
            return false;
        }
    }

    private static Document currentDocument(RenderSession session) {
        String url = session.currentUrl();
        return Jsoup.parse(session.content(), url == null ? "" : url);
    }

    static int requestedPages(
        Integer override,
        CrawlerProperties.Platform platformSettings,
        CrawlerProperties.Pagination pagination
    ) {
        if (override != null) {
            return Math.max(0, override);
        }
        if (platformSettings.getMaxPages() != null) {
            return Math.max(0, platformSettings.getMaxPages());
        }
        return pagination.getMaxPages();
    }

    static int pageLimit(PaginationEstimate estimate, int requestedPages, int hardCap) {
        int limit = estimate.pagesKnown() ? estimate.totalPages() : hardCap;
        if (requestedPages > 0) {
            limit = Math.min(limit, requestedPages);
        }
        return Math.min(limit, hardCap);
    }

    private static TerminationReason limitReason(PaginationEstimate estimate, int requestedPages, int pageLimit, int hardCap) {
        if (estimate.pagesKnown() && pageLimit >= estimate.totalPages()) {
            return TerminationReason.NO_MORE_PAGES;
        }
        if (requestedPages > 0 || pageLimit >= hardCap || estimate.pagesKnown()) {
            return TerminationReason.PAGE_LIMIT_REACHED;
        }
        return TerminationReason.NO_MORE_PAGES;
    }

    static boolean isExcluded(Listing listing, List<String> excludedCountries) {
        if (listing.country() == null || excludedCountries == null || excludedCountries.isEmpty()) {
            return false;
        }
        String country = listing.country().trim().toLowerCase(Locale.ROOT);
        for (String candidate : excludedCountries) {
            if (candidate == null || candidate.isBlank()) {
                continue;
            }
            String normalized = candidate.trim().toLowerCase(Locale.ROOT);
            boolean match = normalized.length() <= 2 ? country.equals(normalized) : country.contains(normalized);
            if (match) {
                return true;
            }
        }
        return false;
    }

    private static boolean pause(CrawlerProperties.Pagination pagination) {
        int min = pagination.getPageDelayMinMs();
        int max = pagination.getPageDelayMaxMs();
        if (max <= 0) {
            return true;
        }
        long sleepMs = min >= max ? min : ThreadLocalRandom.current().nextLong(min, max + 1L);
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private record Prescan(String landedUrl, PaginationEstimate estimate) {
    }
}
