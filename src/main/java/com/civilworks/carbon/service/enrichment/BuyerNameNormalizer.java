package com.civilworks.carbon.service.enrichment;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization of buyer organization names and derivation of their clustering key.
 *
 * <p>Normalized form: trimmed, lower-case, legal-form and government abbreviations expanded,
 * {@code &} spelled out, whitespace collapsed. The key is the upper-case acronym of a
 * multi-word name ("department for transport" gives {@code DFT}) or the upper-cased name itself
 * for a single word ("dft" gives {@code DFT}), so full names and their acronyms meet in one
 * cluster.
 */
public final class BuyerNameNormalizer {
    private static final Pattern LIMITED = Pattern.compile("\\b(ltd\\.?|limited)\\b");
    private static final Pattern PLC = Pattern.compile("\\b(plc\\.?)\\b");
    private static final Pattern COMPANY = Pattern.compile("\\b(co\\.?)\\b");
    private static final Pattern GOVERNMENT = Pattern.compile("\\b(gov\\.?|govt)\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private BuyerNameNormalizer() {}

    public static String normalize(String raw) {
        if (raw == null) return "";
        String text = raw.trim().toLowerCase(Locale.ROOT);
        text = LIMITED.matcher(text).replaceAll("limited");
        text = PLC.matcher(text).replaceAll("plc");
        text = COMPANY.matcher(text).replaceAll("company");
        text = GOVERNMENT.matcher(text).replaceAll("government");
        text = text.replace("&", "and");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String acronym(String normalized) {
        StringBuilder sb = new StringBuilder();
        for (String word : words(normalized)) {
            sb.append(word.charAt(0));
        }
        return sb.toString().toUpperCase(Locale.ROOT);
    }

    /** Clustering key of a raw name. */
    public static String key(String raw) {
        String norm = normalize(raw);
        return words(norm).length > 1 ? acronym(norm) : norm.toUpperCase(Locale.ROOT);
    }

    /** True when the variant, spaces removed and upper-cased, is the key itself ("D f T" for DFT). */
    public static boolean isAcronymForm(String variant, String key) {
        return variant.replace(" ", "").toUpperCase(Locale.ROOT).equals(key);
    }

    private static String[] words(String normalized) {
        return normalized.isEmpty() ? new String[0] : WHITESPACE.split(normalized);
    }
}
