package com.civilworks.carbon.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CpvCodesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String s) throws Exception {
        return mapper.readTree(s.replace('\'', '"'));
    }

    @Test
    public void normalizeKeepsDigitsOnly() {
        assertEquals("452100002", CpvCodes.normalize("45210000-2"));
        assertEquals("45233140", CpvCodes.normalize(" 45233140 "));
        assertEquals(CpvCodes.UNKNOWN, CpvCodes.normalize("n/a"));
        assertEquals(CpvCodes.UNKNOWN, CpvCodes.normalize(null));
    }

    @Test
    public void tenderClassificationWinsOverReleaseLevel() throws Exception {
        JsonNode release = json("{'tender':{'classification':{'id':'45233140'}},'classification':{'id':'71000000'}}");
        assertEquals("45233140", CpvCodes.extract(release.get("tender"), release));
    }

    @Test
    public void firstArrayEntryWithIdIsUsed() throws Exception {
        JsonNode release = json("{'tender':{'classification':[{'scheme':'CPV'},{'id':'45110000-1'},{'id':'71000000'}]}}");
        assertEquals("451100001", CpvCodes.extract(release.get("tender"), release));
    }

    @Test
    public void releaseLevelIsTheLastResort() throws Exception {
        JsonNode release = json("{'tender':{},'classification':{'id':'45240000'}}");
        assertEquals("45240000", CpvCodes.extract(release.get("tender"), release));

        JsonNode none = json("{'tender':{'title':'x'}}");
        assertEquals(CpvCodes.UNKNOWN, CpvCodes.extract(none.get("tender"), none));
    }

    @Test
    public void prefixMatch() {
        List<String> prefixes = List.of("451", "4523");
        assertTrue(CpvCodes.startsWithAny("45233140", prefixes));
        assertTrue(CpvCodes.startsWithAny("45100000", prefixes));
        assertFalse(CpvCodes.startsWithAny("45000000", prefixes));
        assertFalse(CpvCodes.startsWithAny(null, prefixes));
    }
}
