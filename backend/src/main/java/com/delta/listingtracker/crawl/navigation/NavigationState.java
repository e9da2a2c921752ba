package com.delta.listingtracker.crawl.navigation;

import com.delta.listingtracker.crawl.model.NavigationOutcome;

/**
 * Escalation ladder for loading one result page. Each strategy runs at most once per pass and
 * the ladder only moves forward.
 */
public enum NavigationState {
    DIRECT,
    INTERACTIVE_NAV,
    CHALLENGE_RESCUE,
    SUCCESS,
    PAGE_FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == PAGE_FAILED;
    }

    public NavigationState next(NavigationOutcome outcome, boolean rescueAvailable) {
        if (isTerminal()) {
            throw new IllegalStateException("no transition out of terminal state " + this);
        }
        if (outcome == NavigationOutcome.LISTINGS_FOUND) {
            return SUCCESS;
        }
        return switch (this) {
            case DIRECT -> INTERACTIVE_NAV;
            case INTERACTIVE_NAV -> rescueAvailable ? CHALLENGE_RESCUE : PAGE_FAILED;
            default -> PAGE_FAILED;
        };
    }
}
