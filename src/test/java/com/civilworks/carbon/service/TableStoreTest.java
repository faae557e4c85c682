package com.civilworks.carbon.service;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.civilworks.carbon.config.AppProperties;
import com.civilworks.carbon.model.ContractRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TableStoreTest {

    @TempDir
    Path dir;

    private TableStore store;

    @BeforeEach
    void setUp() {
        AppProperties props = new AppProperties();
        props.setDataDir(dir.toString());
        store = new TableStore(new CsvMapper(), props);
    }

    @Test
    public void latin1ExportIsReadAfterUtf8Fails() throws Exception {
        Path file = dir.resolve("export.csv");
        Files.write(file, "ocid,value_amount\nocds-1,£4999.50\n".getBytes(StandardCharsets.ISO_8859_1));

        List<Map<String, String>> rows = store.readRows(file);

        assertEquals(1, rows.size());
        assertEquals("£4999.50", rows.get(0).get("value_amount"));
    }

    @Test
    public void leadingByteOrderMarkIsDropped() throws Exception {
        Path file = dir.resolve("bom.csv");
        Files.write(file, "\uFEFFocid,title\nocds-1,Bridge\n".getBytes(StandardCharsets.UTF_8));

        List<Map<String, String>> rows = store.readRows(file);

        assertEquals("ocds-1", rows.get(0).get("ocid"));
    }

    @Test
    public void missingFileIsReportedAsMissingInput() {
        Path file = dir.resolve("nope.csv");
        MissingInputException ex = assertThrows(MissingInputException.class, () -> store.readRows(file));
        assertEquals(file.toString(), ex.getLocation());
    }

    @Test
    public void contractsSurviveWriteAndRead() {
        ContractRecord c = new ContractRecord();
        c.setOcid("ocds-1");
        c.setTitle("Bridge, \"North\" span");
        c.setDescription("Line one\nline two");
        c.setValue_amount("125000.5");
        c.setBuyer_name("Network Rail");
        Path out = store.resolve("nested/contracts.csv");

        store.writeContracts(out, List.of(c));
        List<ContractRecord> back = store.readContracts(out);

        assertEquals(1, back.size());
        assertEquals("Bridge, \"North\" span", back.get(0).getTitle());
        assertEquals("Line one\nline two", back.get(0).getDescription());
        assertEquals("125000.5", back.get(0).getValue_amount());
        assertNull(back.get(0).getBuyer_name_raw());
    }

    @Test
    public void columnsNotInSchemaAreIgnoredOnWrite() {
        Path out = dir.resolve("map.csv");
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("b", "2");
        row.put("a", "1");
        row.put("extra", "x");

        store.writeRows(out, List.of("a", "b"), List.of(row));

        List<Map<String, String>> back = store.readRows(out);
        assertEquals(List.of("a", "b"), List.copyOf(back.get(0).keySet()));
        assertEquals("1", back.get(0).get("a"));
    }
}
