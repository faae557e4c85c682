package com.civilworks.carbon.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MaterialProfileTest {

    @Test
    public void rowKeywordsAreSplitTrimmedAndLowerCased() {
        MaterialProfile p = MaterialProfile.fromRow(Map.of(
                "material_id", "MAT_STEEL",
                "material_name", "Structural steel",
                "keywords", " Steel | Bridge Deck ||girder ",
                "composite_price_gbp_per_tonne", "1050",
                "carbon_factor_kgco2e_per_tonne", "1550",
                "ice_source_ref", "ICE v3.0"));

        assertEquals(List.of("steel", "bridge deck", "girder"), p.getKeywords());
        assertEquals(1050.0, p.getPrice_per_tonne());
        assertEquals(1550.0, p.getCarbon_factor_kg_co2e_per_tonne());
        assertFalse(p.isGeneric());
    }

    @Test
    public void unparsableNumbersAreMissingButRawTextIsKept() {
        MaterialProfile p = new MaterialProfile("MAT_X", "X", List.of(), "tbc", "NaN", null);

        assertNull(p.getPrice_per_tonne());
        assertNull(p.getCarbon_factor_kg_co2e_per_tonne());
        assertEquals("tbc", p.getRaw_price());
        assertEquals("NaN", p.getRaw_carbon_factor());
    }

    @Test
    public void genericIdIsCaseInsensitive() {
        assertTrue(new MaterialProfile("mat_gen", "Generic", null, "1", "1", null).isGeneric());
        assertTrue(new MaterialProfile("mat_gen", "Generic", null, "1", "1", null).getKeywords().isEmpty());
    }
}
