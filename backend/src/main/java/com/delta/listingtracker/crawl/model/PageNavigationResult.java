package com.delta.listingtracker.crawl.model;

import com.delta.listingtracker.crawl.navigation.NavigationState;

import java.util.ArrayList;
import java.util.List;

public record PageNavigationResult(
    int pageNumber,
    String url,
    NavigationState finalState,
    List<NavigationAttempt> attempts,
    List<Listing> listings
) {
    public PageNavigationResult {
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
        listings = listings == null ? List.of() : List.copyOf(listings);
    }

    public boolean succeeded() {
        return finalState == NavigationState.SUCCESS;
    }

    /**
     * Visited states in order, ending with the terminal state.
     */
    public List<NavigationState> statePath() {
        List<NavigationState> path = new ArrayList<>();
        for (NavigationAttempt attempt : attempts) {
            path.add(attempt.strategy());
        }
        path.add(finalState);
        return path;
    }
}
