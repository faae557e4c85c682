package com.civilworks.carbon.service.enrichment;

import com.civilworks.carbon.model.MaterialProfile;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class MaterialMatcherTest {

    private final MaterialMatcher matcher = new MaterialMatcher();

    private static MaterialProfile profile(String id, String... keywords) {
        return new MaterialProfile(id, id.toLowerCase(), List.of(keywords), "100", "100", "ICE");
    }

    private final List<MaterialProfile> table = List.of(
            profile("MAT_STEEL_PILE", "sheet piling", "cofferdam"),
            profile("MAT_STEEL", "steel", "bridge deck"),
            profile("MAT_ASPHALT", "resurfacing"),
            profile(MaterialProfile.GENERIC_ID));

    @Test
    public void earlierRowWinsOverLaterMatch() {
        Optional<MaterialProfile> m = matcher.match("Steel sheet piling to river wall", table);
        assertEquals("MAT_STEEL_PILE", m.get().getMaterial_id());
    }

    @Test
    public void matchingIsCaseInsensitiveSubstring() {
        assertEquals("MAT_ASPHALT", matcher.match("A38 CARRIAGEWAY RESURFACING", table).get().getMaterial_id());
        assertEquals("MAT_STEEL", matcher.match("Stainless steelwork repairs", table).get().getMaterial_id());
    }

    @Test
    public void genericRowIsTheFallback() {
        assertTrue(matcher.match("Landscape design services", table).get().isGeneric());
        assertTrue(matcher.match(null, table).get().isGeneric());
    }

    @Test
    public void genericRowIsNeverMatchedByKeyword() {
        List<MaterialProfile> genericFirst = List.of(
                profile(MaterialProfile.GENERIC_ID, "bridge"),
                profile("MAT_STEEL", "bridge deck"));
        assertEquals("MAT_STEEL", matcher.match("bridge deck waterproofing", genericFirst).get().getMaterial_id());
    }

    @Test
    public void noMatchAndNoGenericRowIsEmpty() {
        List<MaterialProfile> noGeneric = List.of(profile("MAT_STEEL", "steel"));
        assertTrue(matcher.match("Drainage survey", noGeneric).isEmpty());
    }
}
