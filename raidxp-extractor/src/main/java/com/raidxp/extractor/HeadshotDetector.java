package com.raidxp.extractor;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Decides whether a matched kill line signals a headshot: a non-blank
 * {@code headshot} or {@code hs} capture, or any configured keyword appearing
 * anywhere in the line, case-insensitively.
 */
final class HeadshotDetector {

    private final List<String> keywords;

    HeadshotDetector(List<String> keywords) {
        this.keywords = keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.toUpperCase(Locale.ROOT))
                .toList();
    }

    boolean indicates(String line, Map<String, String> captures) {
        if (!captures.getOrDefault("headshot", "").isBlank()
                || !captures.getOrDefault("hs", "").isBlank()) {
            return true;
        }
        String upper = line.toUpperCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (upper.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
