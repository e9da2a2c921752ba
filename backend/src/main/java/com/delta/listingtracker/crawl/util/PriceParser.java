package com.delta.listingtracker.crawl.util;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Parses marketplace price labels in either European ({@code 12.500,00 €}) or US
 * ({@code $12,500.00}) notation.
 */
public final class PriceParser {
    private PriceParser() {
    }

    public static BigDecimal parse(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = text.replaceAll("[€$£\\s\\u00a0]", "");
        cleaned = cleaned.replaceAll("(?i)(eur|usd|gbp|chf)", "");
        int firstDigit = indexOfDigit(cleaned);
        if (firstDigit < 0) {
            return null;
        }
        cleaned = cleaned.substring(firstDigit).replaceAll("[^\\d.,]", "");
        if (cleaned.contains(".") && cleaned.contains(",")) {
            if (cleaned.lastIndexOf(',') > cleaned.lastIndexOf('.')) {
                cleaned = cleaned.replace(".", "").replace(',', '.');
            } else {
                cleaned = cleaned.replace(",", "");
            }
        } else if (cleaned.contains(",")) {
            String[] parts = cleaned.split(",");
            if (parts.length == 2 && parts[1].length() == 2) {
                cleaned = cleaned.replace(',', '.');
            } else {
                cleaned = cleaned.replace(",", "");
            }
        } else if (cleaned.contains(".")) {
            String[] parts = cleaned.split("\\.");
            if (!(parts.length == 2 && parts[1].length() == 2)) {
                cleaned = cleaned.replace(".", "");
            }
        }
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String currency(String text, String fallback) {
        if (text == null) {
            return fallback;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (text.contains("€") || lower.contains("eur")) {
            return "EUR";
        }
        if (text.contains("£") || lower.contains("gbp")) {
            return "GBP";
        }
        if (lower.contains("chf")) {
            return "CHF";
        }
        if (text.contains("$") || lower.contains("usd")) {
            return "USD";
        }
        return fallback;
    }

    public static Integer parseCount(String text) {
        if (text == null) {
            return null;
        }
        String digits = text.replaceAll("[^\\d]", "");
        if (digits.isEmpty() || digits.length() > 9) {
            return null;
        }
        return Integer.parseInt(digits);
    }

    private static int indexOfDigit(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isDigit(value.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
