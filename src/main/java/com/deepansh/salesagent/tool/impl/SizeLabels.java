package com.deepansh.salesagent.tool.impl;

import java.util.Locale;
import java.util.Map;

/** Size label normalisation: "medium", "m", "Medium" → "M". Unknown labels pass through upper-cased. */
final class SizeLabels {

    private static final Map<String, String> ABBREVIATIONS = Map.ofEntries(
            Map.entry("extra small", "XS"),
            Map.entry("small", "S"),
            Map.entry("medium", "M"),
            Map.entry("large", "L"),
            Map.entry("extra large", "XL"),
            Map.entry("extra extra large", "XXL"),
            Map.entry("xxl", "XXL"),
            Map.entry("xl", "XL"),
            Map.entry("xs", "XS"),
            Map.entry("s", "S"),
            Map.entry("m", "M"),
            Map.entry("l", "L"));

    private SizeLabels() {
    }

    static String normalize(String size) {
        if (size == null || size.isBlank()) return size;
        String key = size.strip().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", " ");
        return ABBREVIATIONS.getOrDefault(key, size.strip().toUpperCase(Locale.ROOT));
    }
}
