package com.civilworks.carbon.service.enrichment;

import java.util.regex.Pattern;

/** Lenient parsing of monetary text such as "£4,999.50" or "GBP 12 000". */
public final class SpendParser {
    private static final Pattern NON_NUMERIC = Pattern.compile("[^\\d.]");

    private SpendParser() {}

    /** Drops everything but digits and dots, then parses. Anything unparsable or not finite is 0.0. */
    public static double parse(String raw) {
        if (raw == null) return 0.0;
        String clean = NON_NUMERIC.matcher(raw).replaceAll("");
        if (clean.isEmpty()) return 0.0;
        try {
            double v = Double.parseDouble(clean);
            return Double.isFinite(v) ? v : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
