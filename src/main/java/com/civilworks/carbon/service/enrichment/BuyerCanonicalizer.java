package com.civilworks.carbon.service.enrichment;

import com.civilworks.carbon.model.BuyerCluster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves spelling variants of buyer organizations to one canonical name per cluster.
 *
 * <p>Names are grouped by {@link BuyerNameNormalizer#key(String)}. Inside a cluster the first
 * variant written as the bare acronym wins ("DfT" over "Department for Transport"); without
 * one, the most frequent variant wins and ties go to the variant seen first.
 *
 * <p>The result depends only on the list passed in. Two unrelated single-word names that
 * normalize identically end up in one cluster; that is a known limit of the heuristic.
 */
@Component
public class BuyerCanonicalizer {
    private static final Logger log = LoggerFactory.getLogger(BuyerCanonicalizer.class);

    /**
     * @param names every buyer-name occurrence of the table, repeats included; null and blank
     *              entries are ignored
     */
    public BuyerCanonicalMap canonicalize(List<String> names) {
        Map<String, List<String>> byKey = new LinkedHashMap<>();
        for (String name : names) {
            if (name == null || name.isBlank()) continue;
            byKey.computeIfAbsent(BuyerNameNormalizer.key(name), k -> new ArrayList<>()).add(name);
        }

        List<BuyerCluster> clusters = new ArrayList<>(byKey.size());
        for (Map.Entry<String, List<String>> e : byKey.entrySet()) {
            clusters.add(new BuyerCluster(e.getKey(), e.getValue(), chooseCanonical(e.getKey(), e.getValue())));
        }
        BuyerCanonicalMap map = new BuyerCanonicalMap(clusters);
        log.info("Canonicalized {} buyer names into {} clusters", map.size(), clusters.size());
        return map;
    }

    static String chooseCanonical(String key, List<String> variants) {
        for (String v : variants) {
            if (BuyerNameNormalizer.isAcronymForm(v, key)) {
                return v;
            }
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String v : variants) {
            counts.merge(v, 1, Integer::sum);
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> c : counts.entrySet()) {
            if (c.getValue() > bestCount) {
                best = c.getKey();
                bestCount = c.getValue();
            }
        }
        return best;
    }
}
