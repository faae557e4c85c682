package com.civilworks.carbon.service.enrichment;

import com.civilworks.carbon.model.BuyerCluster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Raw name to canonical name lookup built from a set of {@link BuyerCluster}s. */
public class BuyerCanonicalMap {
    public static final List<String> COLUMNS = List.of("buyer_name_raw", "buyer_name_canonical");

    private final List<BuyerCluster> clusters;
    private final Map<String, String> canonicalByRaw = new LinkedHashMap<>();

    public BuyerCanonicalMap(List<BuyerCluster> clusters) {
        this.clusters = Collections.unmodifiableList(new ArrayList<>(clusters));
        for (BuyerCluster c : clusters) {
            for (String v : c.distinctVariants()) {
                canonicalByRaw.put(v, c.getCanonical());
            }
        }
    }

    /** Canonical form of {@code raw}; names outside the map (blank ones) come back unchanged. */
    public String canonicalFor(String raw) {
        if (raw == null) return null;
        return canonicalByRaw.getOrDefault(raw, raw);
    }

    /** One row per distinct raw variant, cluster by cluster. */
    public List<Map<String, Object>> rows() {
        List<Map<String, Object>> rows = new ArrayList<>(canonicalByRaw.size());
        for (Map.Entry<String, String> e : canonicalByRaw.entrySet()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("buyer_name_raw", e.getKey());
            row.put("buyer_name_canonical", e.getValue());
            rows.add(row);
        }
        return rows;
    }

    public List<BuyerCluster> getClusters() {
        return clusters;
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(canonicalByRaw);
    }

    /** Number of distinct raw names. */
    public int size() {
        return canonicalByRaw.size();
    }
}
