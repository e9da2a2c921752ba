package com.delta.listingtracker.crawl.service;

import com.delta.listingtracker.config.CrawlerProperties;
import com.delta.listingtracker.crawl.model.Listing;
import com.delta.listingtracker.crawl.model.ResolverSolution;
import com.delta.listingtracker.crawl.model.ScrapeRunResult;
import com.delta.listingtracker.crawl.model.TargetCrawlOutcome;
import com.delta.listingtracker.crawl.model.TerminationReason;
import com.delta.listingtracker.crawl.navigation.PageNavigator;
import com.delta.listingtracker.crawl.platform.Chrono24Platform;
import com.delta.listingtracker.crawl.support.Chrono24Html;
import com.delta.listingtracker.crawl.support.StubChallengeResolver;
import com.delta.listingtracker.crawl.support.StubRenderSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TargetCrawlerServiceTest {
    private final Chrono24Platform platform = new Chrono24Platform(null);
    private final String search = platform.searchUrl("omega");
    private CrawlerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.getPagination().setPageDelayMinMs(0);
        properties.getPagination().setPageDelayMaxMs(0);
        properties.getPagination().setPageRetries(0);
        properties.getPagination().setConsecutiveFailureLimit(2);
    }

    @Test
    void rescuedPageKeepsFailureStreakAtZero() {
        List<Integer> links = List.of(1, 2, 3);
        StubRenderSession session = new StubRenderSession()
            .page(search, Chrono24Html.page(Chrono24Html.cards(100, 10), url(2), links))
            .page(url(2), Chrono24Html.challenge())
            .page(url(3), Chrono24Html.page(Chrono24Html.cards(300, 10), null, links));
        StubChallengeResolver resolver = new StubChallengeResolver(true).solve(
            url(2),
            new ResolverSolution(url(2), 200, Chrono24Html.page(Chrono24Html.cards(200, 10), url(3), links), List.of(), null)
        );

        ScrapeRunResult run = crawl(session, resolver, null).result();

        assertEquals(3, run.pagesAttempted());
        assertEquals(3, run.pagesSucceeded());
        assertEquals(0, run.consecutiveFailures());
        assertThat(run.failedPages()).isEmpty();
        assertEquals(30, run.itemsCollected());
        assertEquals(TerminationReason.NO_MORE_PAGES, run.terminatedReason());
    }

    @Test
    void singleFailedPageIsRecordedAndCrawlContinues() {
        List<Integer> links = List.of(1, 2, 3);
        StubRenderSession session = new StubRenderSession()
            .page(search, Chrono24Html.page(Chrono24Html.cards(100, 10), url(2), links))
            .page(url(3), Chrono24Html.page(Chrono24Html.cards(300, 10), null, links));

        ScrapeRunResult run = crawl(session, StubChallengeResolver.disabled(), null).result();

        assertEquals(3, run.pagesAttempted());
        assertEquals(2, run.pagesSucceeded());
        assertThat(run.failedPages()).containsExactly(2);
        assertEquals(0, run.consecutiveFailures());
        assertEquals(20, run.itemsCollected());
        assertEquals(3, run.pagesTotalDetected());
        assertEquals(TerminationReason.NO_MORE_PAGES, run.terminatedReason());
    }

    @Test
    void stopsAfterConsecutiveFailureLimit() {
        List<Integer> links = List.of(1, 2, 3, 4, 5);
        StubRenderSession session = new StubRenderSession()
            .page(search, Chrono24Html.page(Chrono24Html.cards(100, 10), url(2), links))
            .page(url(4), Chrono24Html.page(Chrono24Html.cards(400, 10), url(5), links))
            .page(url(5), Chrono24Html.page(Chrono24Html.cards(500, 10), null, links));

        ScrapeRunResult run = crawl(session, StubChallengeResolver.disabled(), null).result();

        assertEquals(3, run.pagesAttempted());
        assertEquals(2, run.consecutiveFailures());
        assertThat(run.failedPages()).containsExactly(2, 3);
        assertEquals(TerminationReason.CONSECUTIVE_FAILURE_LIMIT, run.terminatedReason());
        assertEquals(0, session.navigationsTo(url(4)));
    }

    @Test
    void deduplicatesListingsRepeatedAcrossPages() {
        List<Integer> links = List.of(1, 2);
        StubRenderSession session = new StubRenderSession()
            .page(search, Chrono24Html.page(Chrono24Html.cards(100, 10), url(2), links))
            .page(url(2), Chrono24Html.page(Chrono24Html.cards(105, 10), null, links));

        TargetCrawlOutcome outcome = crawl(session, StubChallengeResolver.disabled(), null);

        assertEquals(20, outcome.result().rawItemsExtracted());
        assertEquals(15, outcome.result().itemsCollected());
        assertThat(outcome.listings()).hasSize(15);
        Listing repeated = outcome.listings().stream()
            .filter(listing -> listing.listingId().equals("105"))
            .findFirst()
            .orElseThrow();
        assertEquals(1, repeated.seenAtPage());
    }

    @Test
    void excludedCountriesAreCountedButNotCollected() {
        CrawlerProperties.Platform settings = new CrawlerProperties.Platform();
        settings.setEnabled(true);
        settings.setExcludedCountries(List.of("JP", "Japón"));
        properties.getPlatforms().put(Chrono24Platform.NAME, settings);
        String cards = Chrono24Html.cards(100, 3)
            + Chrono24Html.card("900", "€ 2.000", "JP")
            + Chrono24Html.card("901", "€ 2.100", "Tokio, Japón");
        StubRenderSession session = new StubRenderSession()
            .page(search, Chrono24Html.page(cards, null, List.of(1)));

        TargetCrawlOutcome outcome = crawl(session, StubChallengeResolver.disabled(), null);

        assertEquals(3, outcome.result().itemsCollected());
        assertEquals(2, outcome.result().itemsExcluded());
        assertThat(outcome.listings()).extracting(Listing::listingId).doesNotContain("900", "901");
    }

    @Test
    void unknownTotalsFollowNextLinksUntilTheyRunOut() {
        StubRenderSession session = new StubRenderSession()
            .page(search, Chrono24Html.page(Chrono24Html.cards(100, 10), url(2), List.of()))
            .page(url(2), Chrono24Html.page(Chrono24Html.cards(200, 7), null, List.of()));

        ScrapeRunResult run = crawl(session, StubChallengeResolver.disabled(), null).result();

        assertNull(run.pagesTotalDetected());
        assertNull(run.pageCoverage());
        assertEquals(2, run.pagesAttempted());
        assertEquals(17, run.itemsCollected());
        assertEquals(TerminationReason.NO_MORE_PAGES, run.terminatedReason());
    }

    @Test
    void unreadablePageKeepsListingsCollectedSoFar() {
        StubRenderSession session = new StubRenderSession()
            .page(search, Chrono24Html.page(Chrono24Html.cards(100, 10), url(2), List.of()))
            .contentUnreadable();

        TargetCrawlOutcome outcome = crawl(session, StubChallengeResolver.disabled(), null);

        assertEquals(1, outcome.result().pagesAttempted());
        assertEquals(10, outcome.result().itemsCollected());
        assertThat(outcome.listings()).hasSize(10);
        assertEquals(TerminationReason.NO_MORE_PAGES, outcome.result().terminatedReason());
    }

    @Test
    void explicitPageLimitStopsEarly() {
        List<Integer> links = List.of(1, 2, 3, 4, 5);
        StubRenderSession session = new StubRenderSession()
            .page(search, Chrono24Html.page(Chrono24Html.cards(100, 10), url(2), links))
            .page(url(2), Chrono24Html.page(Chrono24Html.cards(200, 10), url(3), links));

        ScrapeRunResult run = crawl(session, StubChallengeResolver.disabled(), 2).result();

        assertEquals(2, run.pagesAttempted());
        assertEquals(5, run.pagesTotalDetected());
        assertEquals(TerminationReason.PAGE_LIMIT_REACHED, run.terminatedReason());
        assertEquals(0, session.navigationsTo(url(3)));
    }

    @Test
    void sessionIsClosedAfterCrawl() {
        StubRenderSession session = new StubRenderSession()
            .page(search, Chrono24Html.page(Chrono24Html.cards(100, 2), null, List.of(1)));
        StubChallengeResolver resolver = StubChallengeResolver.disabled();
        TargetCrawlerService service = new TargetCrawlerService(
            new PageNavigator(resolver, properties),
            () -> session,
            resolver,
            properties
        );

        service.crawl(platform, "omega", null);

        assertTrue(session.isClosed());
    }

    @Test
    void requestedPagesPrefersOverrideThenPlatformThenGlobal() {
        CrawlerProperties.Platform settings = new CrawlerProperties.Platform();
        CrawlerProperties.Pagination pagination = new CrawlerProperties.Pagination();
        pagination.setMaxPages(7);

        assertEquals(7, TargetCrawlerService.requestedPages(null, settings, pagination));
        settings.setMaxPages(3);
        assertEquals(3, TargetCrawlerService.requestedPages(null, settings, pagination));
        assertEquals(1, TargetCrawlerService.requestedPages(1, settings, pagination));
    }

    private String url(int page) {
        return platform.pageUrl(search, page);
    }

    private TargetCrawlOutcome crawl(StubRenderSession session, StubChallengeResolver resolver, Integer maxPages) {
        TargetCrawlerService service = new TargetCrawlerService(
            new PageNavigator(resolver, properties),
            () -> session,
            resolver,
            properties
        );
        return service.crawl(session, platform, "omega", maxPages);
    }
}
