package com.delta.listingtracker.crawl.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PriceParserTest {

    @Test
    void parsesEuropeanNotation() {
        assertPrice("12500.00", PriceParser.parse("12.500,00 €"));
        assertPrice("1500", PriceParser.parse("€ 1.500"));
        assertPrice("950.50", PriceParser.parse("950,50 EUR"));
    }

    @Test
    void parsesUsNotation() {
        assertPrice("12500.00", PriceParser.parse("$12,500.00"));
        assertPrice("3200", PriceParser.parse("USD 3,200"));
        assertPrice("99.99", PriceParser.parse("$99.99"));
    }

    @Test
    void ignoresLeadingLabels() {
        assertPrice("950", PriceParser.parse("Precio: 950 €"));
    }

    @Test
    void returnsNullWithoutDigits() {
        assertNull(PriceParser.parse("Precio a consultar"));
        assertNull(PriceParser.parse(null));
    }

    @Test
    void detectsCurrency() {
        assertEquals("EUR", PriceParser.currency("1.500 €", "USD"));
        assertEquals("GBP", PriceParser.currency("£1,200", "EUR"));
        assertEquals("CHF", PriceParser.currency("CHF 4'500", "EUR"));
        assertEquals("USD", PriceParser.currency("$800", "EUR"));
        assertEquals("EUR", PriceParser.currency("800", "EUR"));
    }

    @Test
    void parsesCounts() {
        assertEquals(1234, PriceParser.parseCount("1.234 "));
        assertEquals(58211, PriceParser.parseCount("58 211"));
        assertNull(PriceParser.parseCount("sin resultados"));
    }

    private static void assertPrice(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }
}
