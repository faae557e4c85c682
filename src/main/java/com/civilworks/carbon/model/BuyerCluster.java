package com.civilworks.carbon.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Raw buyer-name variants sharing one clustering key, with the representative chosen for them.
 * {@code variants} keeps every occurrence in order of appearance, repeats included.
 */
public class BuyerCluster {
    private final String key;
    private final List<String> variants;
    private final String canonical;

    public BuyerCluster(String key, List<String> variants, String canonical) {
        this.key = key;
        this.variants = Collections.unmodifiableList(new ArrayList<>(variants));
        this.canonical = canonical;
    }

    public String getKey() { return key; }
    public List<String> getVariants() { return variants; }
    public String getCanonical() { return canonical; }

    /** Variants without repeats, first-appearance order. */
    public Set<String> distinctVariants() {
        return new LinkedHashSet<>(variants);
    }
}
