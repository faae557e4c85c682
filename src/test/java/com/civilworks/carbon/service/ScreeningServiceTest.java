package com.civilworks.carbon.service;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.civilworks.carbon.config.AppProperties;
import com.civilworks.carbon.dto.PipelineDtos;
import com.civilworks.carbon.model.ContractRecord;
import com.civilworks.carbon.service.enrichment.MaterialMatcher;
import com.civilworks.carbon.service.enrichment.RiskEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ScreeningServiceTest {

    @TempDir
    Path dir;

    private static ContractRecord contract(String ocid, String title, String value) {
        ContractRecord c = new ContractRecord();
        c.setOcid(ocid);
        c.setTitle(title);
        c.setValue_amount(value);
        c.setBuyer_name("Network Rail");
        return c;
    }

    @Test
    public void screenedTableIsRankedAgainstBundledReference() {
        AppProperties props = new AppProperties();
        props.setDataDir(dir.toString());
        TableStore store = new TableStore(new CsvMapper(), props);
        store.writeContracts(store.resolve(props.getFiles().getCleaned()), List.of(
                contract("kerb", "Kerb works", "1000"),
                contract("road", "Carriageway resurfacing A12", "500000"),
                contract("design", "Design services", "100000"),
                contract("bridge", "Bridge deck replacement", "2100000")));
        ScreeningService service = new ScreeningService(
                new RiskEngine(new MaterialMatcher(), props),
                new MaterialReferenceLoader(props, store),
                props, store);

        PipelineDtos.ScreeningReport report = service.run();

        assertEquals(4, report.getContracts());
        assertEquals(3, report.getStatus_counts().get("CALCULATED"));
        assertEquals(1, report.getStatus_counts().get("SKIPPED_LOW_VALUE"));
        assertEquals(0, report.getStatus_counts().get("SKIPPED_NO_REF"));

        List<Map<String, String>> rows = store.readRows(store.resolve(props.getFiles().getScreened()));
        assertEquals(List.of("bridge", "road", "design", "kerb"),
                rows.stream().map(r -> r.get("ocid")).collect(Collectors.toList()));

        Map<String, String> bridge = rows.get(0);
        assertEquals("MAT_STEEL", bridge.get("detected_material_id"));
        assertEquals(3100.0, Double.parseDouble(bridge.get("est_co2e_tonnes")));
        assertEquals("CRITICAL", bridge.get("risk_category"));
        assertEquals("MAT_ASPHALT", rows.get(1).get("detected_material_id"));
        assertEquals("HIGH", rows.get(1).get("risk_category"));
        assertEquals("MAT_GEN", rows.get(2).get("detected_material_id"));
        assertEquals("MEDIUM", rows.get(2).get("risk_category"));
        assertEquals("SKIPPED_LOW_VALUE", rows.get(3).get("pqe_status"));
        assertEquals("", rows.get(3).get("est_co2e_tonnes"));
    }
}
