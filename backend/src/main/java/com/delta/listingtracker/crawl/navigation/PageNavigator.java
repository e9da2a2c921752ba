package com.delta.listingtracker.crawl.navigation;

import com.delta.listingtracker.config.CrawlerProperties;
import com.delta.listingtracker.crawl.model.Listing;
import com.delta.listingtracker.crawl.model.NavigationAttempt;
import com.delta.listingtracker.crawl.model.NavigationOutcome;
import com.delta.listingtracker.crawl.model.PageNavigationResult;
import com.delta.listingtracker.crawl.model.PageSnapshot;
import com.delta.listingtracker.crawl.model.ResolverSolution;
import com.delta.listingtracker.crawl.platform.MarketplacePlatform;
import com.delta.listingtracker.crawl.render.NavigationException;
import com.delta.listingtracker.crawl.render.RenderSession;
import com.delta.listingtracker.crawl.resolver.ChallengeResolver;
import com.delta.listingtracker.crawl.resolver.ResolverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads one result page by escalating DIRECT, then INTERACTIVE_NAV, then CHALLENGE_RESCUE until
 * listings appear or every strategy is spent.
 */
@Component
public class PageNavigator {
    private static final Logger log = LoggerFactory.getLogger(PageNavigator.class);

    private final ChallengeResolver resolver;
    private final CrawlerProperties properties;

    public PageNavigator(ChallengeResolver resolver, CrawlerProperties properties) {
        this.resolver = resolver;
        this.properties = properties;
    }

    /**
     * @param previousPageUrl URL of the page before this one, {@code null} for page 1
     */
    public PageNavigationResult navigate(
        RenderSession session,
        MarketplacePlatform platform,
        int pageNumber,
        String targetUrl,
        String previousPageUrl
    ) {
        List<NavigationAttempt> attempts = new ArrayList<>();
        NavigationState state = NavigationState.DIRECT;
        List<Listing> listings = List.of();
        boolean rescueAvailable = resolver.isEnabled();

        while (!state.isTerminal()) {
            StepResult step;
            try {
                step = switch (state) {
                    case DIRECT -> direct(session, platform, pageNumber, targetUrl);
                    case INTERACTIVE_NAV -> interactive(session, platform, pageNumber, previousPageUrl);
                    case CHALLENGE_RESCUE -> rescue(session, platform, pageNumber, targetUrl);
                    default -> throw new IllegalStateException("unexpected state " + state);
                };
            } catch (NavigationException e) {
                step = StepResult.of(NavigationOutcome.ERROR, e.reasonCode() + ": " + e.getMessage());
            }
            attempts.add(new NavigationAttempt(pageNumber, state, step.outcome(), step.listings().size(), step.detail()));
            log.debug("{} page {} {} -> {} ({} listings)", platform.name(), pageNumber, state, step.outcome(), step.listings().size());
            if (step.outcome() == NavigationOutcome.LISTINGS_FOUND) {
                listings = step.listings();
            }
            state = state.next(step.outcome(), rescueAvailable);
        }

        PageNavigationResult result = new PageNavigationResult(pageNumber, targetUrl, state, attempts, listings);
        if (state == NavigationState.PAGE_FAILED) {
            log.warn(
                "{} page {} failed after {} ({})",
                platform.name(),
                pageNumber,
                strategyChain(result),
                attempts.stream().map(NavigationAttempt::detail).collect(Collectors.joining("; "))
            );
        } else if (attempts.size() > 1) {
            log.info("{} page {} recovered via {}", platform.name(), pageNumber, strategyChain(result));
        }
        return result;
    }

    private StepResult direct(RenderSession session, MarketplacePlatform platform, int pageNumber, String targetUrl) {
        PageSnapshot snapshot = session.navigate(targetUrl);
        if (!snapshot.ok()) {
            return StepResult.of(NavigationOutcome.BLOCKED, "http " + snapshot.statusCode());
        }
        dismissOverlays(session, platform);
        return inspect(session, platform, pageNumber, false);
    }

    private StepResult interactive(RenderSession session, MarketplacePlatform platform, int pageNumber, String previousPageUrl) {
        dismissOverlays(session, platform);
        if (previousPageUrl == null) {
            return StepResult.of(NavigationOutcome.NO_CONTROL, "no previous page to navigate from");
        }
        if (!samePage(session.currentUrl(), previousPageUrl)) {
            PageSnapshot snapshot = session.navigate(previousPageUrl);
            if (!snapshot.ok()) {
                return StepResult.of(NavigationOutcome.BLOCKED, "previous page http " + snapshot.statusCode());
            }
            dismissOverlays(session, platform);
        }
        boolean clicked = false;
        for (String selector : platform.nextPageSelectors()) {
            if (session.click(selector)) {
                clicked = true;
                break;
            }
        }
        if (!clicked) {
            return StepResult.of(NavigationOutcome.NO_CONTROL, "no next-page control");
        }
        dismissOverlays(session, platform);
        return inspect(session, platform, pageNumber, false);
    }

    private StepResult rescue(RenderSession session, MarketplacePlatform platform, int pageNumber, String targetUrl) {
        ResolverSolution solution;
        try {
            solution = resolver.resolve(targetUrl, Duration.ofSeconds(properties.getResolver().getTimeoutSeconds()));
        } catch (ResolverException e) {
            return StepResult.of(NavigationOutcome.RESOLVER_FAILED, e.reasonCode() + ": " + e.getMessage());
        }
        String renavigateFailure = null;
        try {
            session.addCookies(solution.cookies(), solution.userAgent());
            PageSnapshot snapshot = session.navigate(targetUrl);
            if (snapshot.ok()) {
                dismissOverlays(session, platform);
                StepResult renavigated = inspect(session, platform, pageNumber, false);
                if (renavigated.outcome() == NavigationOutcome.LISTINGS_FOUND) {
                    return renavigated.withDetail("re-navigated with resolver cookies");
                }
            }
        } catch (NavigationException e) {
            renavigateFailure = e.reasonCode() + ": " + e.getMessage();
            log.debug("{} page {} re-navigation after resolution failed: {}", platform.name(), pageNumber, renavigateFailure);
        }
        if (!solution.hasHtml()) {
            return renavigateFailure == null
                ? StepResult.of(NavigationOutcome.EMPTY, "resolver returned no content")
                : StepResult.of(NavigationOutcome.ERROR, renavigateFailure);
        }
        session.setContent(solution.html());
        return inspect(session, platform, pageNumber, true).withDetail("resolver content");
    }

    private StepResult inspect(RenderSession session, MarketplacePlatform platform, int pageNumber, boolean useFallbacks) {
        List<Listing> listings = extract(session, platform, platform.listingSelector(), pageNumber);
        if (listings.isEmpty() && useFallbacks) {
            for (String selector : platform.fallbackListingSelectors()) {
                listings = extract(session, platform, selector, pageNumber);
                if (!listings.isEmpty()) {
                    break;
                }
            }
        }
        if (!listings.isEmpty()) {
            return new StepResult(NavigationOutcome.LISTINGS_FOUND, listings, null);
        }
        if (hasChallenge(session, platform)) {
            return StepResult.of(NavigationOutcome.CHALLENGE, "challenge markers present");
        }
        return StepResult.of(NavigationOutcome.EMPTY, "no listings matched");
    }

    private List<Listing> extract(RenderSession session, MarketplacePlatform platform, String selector, int pageNumber) {
        List<String> fragments = session.outerHtml(selector);
        if (fragments.isEmpty()) {
            return List.of();
        }
        List<Listing> out = new ArrayList<>();
        for (Listing listing : platform.parseListings(fragments, session.currentUrl(), pageNumber)) {
            if (listing.listingId() != null && !listing.listingId().isBlank()) {
                out.add(listing);
            }
        }
        return out;
    }

    private boolean hasChallenge(RenderSession session, MarketplacePlatform platform) {
        for (String selector : platform.challengeSelectors()) {
            if (session.exists(selector)) {
                return true;
            }
        }
        return false;
    }

    public void dismissOverlays(RenderSession session, MarketplacePlatform platform) {
        for (String selector : platform.overlaySelectors()) {
            try {
                if (session.click(selector)) {
                    log.debug("Dismissed overlay via {}", selector);
                }
            } catch (NavigationException e) {
                log.debug("Overlay {} not dismissable: {}", selector, e.getMessage());
            }
        }
    }

    static String strategyChain(PageNavigationResult result) {
        return result.statePath().stream().map(Enum::name).collect(Collectors.joining(" -> "));
    }

    private static boolean samePage(String current, String expected) {
        if (current == null || expected == null) {
            return false;
        }
        return stripSlash(current).equals(stripSlash(expected));
    }

    private static String stripSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private record StepResult(NavigationOutcome outcome, List<Listing> listings, String detail) {
        static StepResult of(NavigationOutcome outcome, String detail) {
            return new StepResult(outcome, List.of(), detail);
        }

        StepResult withDetail(String newDetail) {
            return new StepResult(outcome, listings, newDetail);
        }
    }
}
