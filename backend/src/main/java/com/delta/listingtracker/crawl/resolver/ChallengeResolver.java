package com.delta.listingtracker.crawl.resolver;

import com.delta.listingtracker.crawl.model.ResolverSolution;

import java.time.Duration;

/**
 * External service that loads a URL behind an anti-bot challenge and hands back the rendered
 * page plus the session cookies it earned.
 */
public interface ChallengeResolver {

    /**
     * @throws ResolverUnavailableException when the service is disabled or unreachable
     * @throws ResolverTimeoutException when no answer arrives within the timeout
     * @throws ResolverRejectedException when the service answers with an error
     */
    ResolverSolution resolve(String url, Duration timeout);

    boolean isEnabled();
}
