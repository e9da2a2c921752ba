package com.delta.listingtracker.crawl.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoverageDecisionTest {

    @Test
    void acceptedDecisionIsValidWithoutReason() {
        CoverageDecision decision = CoverageDecision.accept();

        assertTrue(decision.valid());
        assertNull(decision.reason());
    }

    @Test
    void invalidDecisionCarriesReason() {
        CoverageDecision decision = CoverageDecision.invalid(CoverageDecision.BELOW_MINIMUM_FLOOR);

        assertFalse(decision.valid());
        assertEquals("below minimum floor", decision.reason());
    }
}
