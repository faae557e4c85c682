package com.civilworks.carbon.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One row of the material reference table: keyword triggers mapped to a composite unit
 * price and an embodied-carbon factor.
 *
 * <p>Tables are ordered most-specific first and must contain exactly one generic row whose
 * id is {@link #GENERIC_ID}. The generic row is never matched by keyword; it is the
 * fallback when no specific row matches.
 *
 * <p>Price and factor are kept both parsed (null when absent or not numeric) and as the raw
 * cell text so rejected rows can be reported as they were written.
 */
public class MaterialProfile {
    public static final String GENERIC_ID = "MAT_GEN";

    private final String material_id;
    private final String material_name;
    private final List<String> keywords;
    private final Double price_per_tonne;
    private final Double carbon_factor_kg_co2e_per_tonne;
    private final String source_reference;
    private final String raw_price;
    private final String raw_carbon_factor;

    public MaterialProfile(String materialId, String materialName, List<String> keywords,
                           String rawPrice, String rawCarbonFactor, String sourceReference) {
        this.material_id = materialId;
        this.material_name = materialName;
        this.keywords = keywords == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(keywords));
        this.raw_price = rawPrice;
        this.raw_carbon_factor = rawCarbonFactor;
        this.price_per_tonne = parseNumber(rawPrice);
        this.carbon_factor_kg_co2e_per_tonne = parseNumber(rawCarbonFactor);
        this.source_reference = sourceReference;
    }

    /**
     * Builds a profile from a reference CSV row. Keywords are pipe-delimited; each is trimmed
     * and lower-cased and blanks are dropped.
     */
    public static MaterialProfile fromRow(Map<String, String> row) {
        return new MaterialProfile(
                trimToNull(row.get("material_id")),
                trimToNull(row.get("material_name")),
                splitKeywords(row.get("keywords")),
                row.get("composite_price_gbp_per_tonne"),
                row.get("carbon_factor_kgco2e_per_tonne"),
                trimToNull(row.get("ice_source_ref")));
    }

    public static List<String> splitKeywords(String cell) {
        List<String> out = new ArrayList<>();
        if (cell == null) return out;
        for (String k : cell.split("\\|")) {
            String t = k.trim().toLowerCase(Locale.ROOT);
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    public boolean isGeneric() {
        return material_id != null && GENERIC_ID.equalsIgnoreCase(material_id.trim());
    }

    private static Double parseNumber(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            double v = Double.parseDouble(raw.trim());
            return Double.isNaN(v) ? null : v;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    public String getMaterial_id() { return material_id; }
    public String getMaterial_name() { return material_name; }
    public List<String> getKeywords() { return keywords; }
    public Double getPrice_per_tonne() { return price_per_tonne; }
    public Double getCarbon_factor_kg_co2e_per_tonne() { return carbon_factor_kg_co2e_per_tonne; }
    public String getSource_reference() { return source_reference; }
    public String getRaw_price() { return raw_price; }
    public String getRaw_carbon_factor() { return raw_carbon_factor; }

    @Override
    public String toString() {
        return "MaterialProfile{" + material_id + ", " + material_name + "}";
    }
}
