package com.musicgraph.harvester.model;

/**
 * Inclusive release-year range.
 *
 * @param start first year (inclusive)
 * @param end last year (inclusive)
 */
public record YearRange(int start, int end) {
    public YearRange {
        if (start > end) {
            throw new IllegalArgumentException("Year range start " + start + " is after end " + end);
        }
    }

    /**
     * Parses "2020" or "2018-2022".
     * @param text range text
     * @return parsed range
     * @throws IllegalArgumentException on malformed input
     */
    public static YearRange parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Year range cannot be empty");
        }
        String trimmed = text.trim();
        try {
            int dash = trimmed.indexOf('-');
            if (dash < 0) {
                int year = Integer.parseInt(trimmed);
                return new YearRange(year, year);
            }
            int start = Integer.parseInt(trimmed.substring(0, dash).trim());
            int end = Integer.parseInt(trimmed.substring(dash + 1).trim());
            return new YearRange(start, end);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid year range: " + text, e);
        }
    }

    public boolean contains(Integer year) {
        return year != null && year >= start && year <= end;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
