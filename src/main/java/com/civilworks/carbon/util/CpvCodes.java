package com.civilworks.carbon.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;

/**
 * CPV (Common Procurement Vocabulary) code helpers. Codes are hierarchical, so a prefix
 * selects a whole branch: "45" is construction work, "4523" pipelines, roads and railways.
 */
public final class CpvCodes {
    public static final String UNKNOWN = "UNKNOWN";

    private CpvCodes() {}

    /** Keeps the digits only; "45210000-2" becomes "452100002". Null or digit-free input yields {@link #UNKNOWN}. */
    public static String normalize(String raw) {
        if (raw == null || raw.isEmpty()) return UNKNOWN;
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c >= '0' && c <= '9') sb.append(c);
        }
        return sb.length() == 0 ? UNKNOWN : sb.toString();
    }

    /**
     * Reads the code of an OCDS release: {@code tender.classification} as an object, else the
     * first entry with an id of a {@code tender.classification} array, else the release-level
     * {@code classification}.
     */
    public static String extract(JsonNode tender, JsonNode release) {
        JsonNode classification = tender == null ? null : tender.get("classification");
        if (classification != null && classification.isObject()) {
            return normalize(textOrNull(classification.get("id")));
        }
        if (classification != null && classification.isArray()) {
            for (JsonNode c : classification) {
                String id = c.isObject() ? textOrNull(c.get("id")) : null;
                if (id != null && !id.isEmpty()) {
                    return normalize(id);
                }
            }
        }
        JsonNode top = release.get("classification");
        if (top != null && top.isObject()) {
            return normalize(textOrNull(top.get("id")));
        }
        return UNKNOWN;
    }

    public static boolean startsWithAny(String code, Collection<String> prefixes) {
        if (code == null || prefixes == null) return false;
        for (String p : prefixes) {
            if (p != null && !p.isEmpty() && code.startsWith(p)) return true;
        }
        return false;
    }

    private static String textOrNull(JsonNode n) {
        return n == null || n.isNull() ? null : n.asText();
    }
}
