package com.civilworks.carbon.service;

import com.civilworks.carbon.config.AppProperties;
import com.civilworks.carbon.dto.PipelineDtos;
import com.civilworks.carbon.model.ContractRecord;
import com.civilworks.carbon.model.MaterialProfile;
import com.civilworks.carbon.model.PqeStatus;
import com.civilworks.carbon.model.RiskRecord;
import com.civilworks.carbon.service.enrichment.RiskEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Screens the cleaned table against the material reference and writes the ranked output. */
@Service
public class ScreeningService {
    private static final Logger log = LoggerFactory.getLogger(ScreeningService.class);

    private final RiskEngine riskEngine;
    private final MaterialReferenceLoader materialReferenceLoader;
    private final AppProperties appProperties;
    private final TableStore tableStore;

    public ScreeningService(RiskEngine riskEngine, MaterialReferenceLoader materialReferenceLoader,
                            AppProperties appProperties, TableStore tableStore) {
        this.riskEngine = riskEngine;
        this.materialReferenceLoader = materialReferenceLoader;
        this.appProperties = appProperties;
        this.tableStore = tableStore;
    }

    public PipelineDtos.ScreeningReport run() {
        Path in = tableStore.resolve(appProperties.getFiles().getCleaned());
        List<ContractRecord> contracts = tableStore.readContracts(in);
        List<MaterialProfile> materials = materialReferenceLoader.load();
        log.info("Loaded {} contracts and {} material profiles", contracts.size(), materials.size());

        List<RiskRecord> results = riskEngine.screen(contracts, materials);

        Path out = tableStore.resolve(appProperties.getFiles().getScreened());
        List<Map<String, Object>> rows = new ArrayList<>(results.size());
        for (RiskRecord r : results) {
            rows.add(r.toRow());
        }
        tableStore.writeRows(out, RiskRecord.columns(), rows);

        PipelineDtos.ScreeningReport report = new PipelineDtos.ScreeningReport();
        report.setContracts(contracts.size());
        report.setMaterials(materials.size());
        for (PqeStatus s : PqeStatus.values()) {
            report.getStatus_counts().put(s.name(), 0);
        }
        for (RiskRecord r : results) {
            report.getStatus_counts().merge(r.getStatus().name(), 1, Integer::sum);
        }
        report.setOutput_path(out.toString());

        logTopRisks(results, appProperties.getScreening().getSummaryTop());
        return report;
    }

    private void logTopRisks(List<RiskRecord> ranked, int top) {
        List<RiskRecord> calculated = ranked.stream()
                .filter(r -> r.getStatus() == PqeStatus.CALCULATED)
                .limit(Math.max(0, top))
                .toList();
        if (calculated.isEmpty()) {
            log.info("No contract produced a carbon estimate");
            return;
        }
        log.info("Top {} highest carbon risks:", calculated.size());
        for (RiskRecord r : calculated) {
            log.info("  {} t CO2e [{}] {} | {} | {}",
                    r.getEstimate().getEst_co2e_tonnes(), r.getEstimate().getRisk_category(),
                    r.getContract().getBuyer_name(), r.getContract().getTitle(),
                    r.getEstimate().getDetected_material_name());
        }
    }
}
