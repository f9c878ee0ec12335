package com.deepansh.salesagent.core;

import java.util.Locale;

/** "PROD-mens-shirt", "Men's Shirt" and "mens_shirt" all slug to "mens-shirt". */
final class Slugs {

    private static final String PRODUCT_PREFIX = "prod-";

    private Slugs() {
    }

    static String of(String value) {
        if (value == null) return "";
        String s = value.toLowerCase(Locale.ROOT).strip()
                .replace("'", "")
                .replace("’", "")
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (s.startsWith(PRODUCT_PREFIX)) {
            s = s.substring(PRODUCT_PREFIX.length());
        }
        return s;
    }

    /** Equal, or one is a prefix/suffix of the other. Empty slugs never match. */
    static boolean related(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) return false;
        return a.equals(b)
                || a.startsWith(b) || b.startsWith(a)
                || a.endsWith(b) || b.endsWith(a);
    }
}
