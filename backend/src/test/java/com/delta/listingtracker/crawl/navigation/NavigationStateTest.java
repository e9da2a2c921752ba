package com.delta.listingtracker.crawl.navigation;

import com.delta.listingtracker.crawl.model.NavigationOutcome;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NavigationStateTest {

    @Test
    void listingsAlwaysLeadToSuccess() {
        assertThat(NavigationState.DIRECT.next(NavigationOutcome.LISTINGS_FOUND, true)).isEqualTo(NavigationState.SUCCESS);
        assertThat(NavigationState.INTERACTIVE_NAV.next(NavigationOutcome.LISTINGS_FOUND, false)).isEqualTo(NavigationState.SUCCESS);
        assertThat(NavigationState.CHALLENGE_RESCUE.next(NavigationOutcome.LISTINGS_FOUND, true)).isEqualTo(NavigationState.SUCCESS);
    }

    @Test
    void failuresEscalateInOrder() {
        assertThat(NavigationState.DIRECT.next(NavigationOutcome.CHALLENGE, true)).isEqualTo(NavigationState.INTERACTIVE_NAV);
        assertThat(NavigationState.DIRECT.next(NavigationOutcome.BLOCKED, false)).isEqualTo(NavigationState.INTERACTIVE_NAV);
        assertThat(NavigationState.INTERACTIVE_NAV.next(NavigationOutcome.NO_CONTROL, true)).isEqualTo(NavigationState.CHALLENGE_RESCUE);
        assertThat(NavigationState.CHALLENGE_RESCUE.next(NavigationOutcome.RESOLVER_FAILED, true)).isEqualTo(NavigationState.PAGE_FAILED);
        assertThat(NavigationState.CHALLENGE_RESCUE.next(NavigationOutcome.EMPTY, true)).isEqualTo(NavigationState.PAGE_FAILED);
    }

    @Test
    void rescueIsSkippedWhenUnavailable() {
        assertThat(NavigationState.INTERACTIVE_NAV.next(NavigationOutcome.EMPTY, false)).isEqualTo(NavigationState.PAGE_FAILED);
    }

    @Test
    void terminalStatesHaveNoTransitions() {
        assertThat(NavigationState.SUCCESS.isTerminal()).isTrue();
        assertThat(NavigationState.PAGE_FAILED.isTerminal()).isTrue();
        assertThat(NavigationState.DIRECT.isTerminal()).isFalse();
        assertThatThrownBy(() -> NavigationState.SUCCESS.next(NavigationOutcome.EMPTY, true))
            .isInstanceOf(IllegalStateException.class);
    }
}
