package com.civilworks.carbon.service;

import com.civilworks.carbon.config.AppProperties;
import com.civilworks.carbon.dto.PipelineDtos;
import com.civilworks.carbon.model.ContractRecord;
import com.civilworks.carbon.util.CpvCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Narrows the broad construction table to heavy civil works: site preparation, engineering
 * structures, pipelines/roads/railways, water projects and industrial plant.
 */
@Service
public class CivilWorksFilter {
    private static final Logger log = LoggerFactory.getLogger(CivilWorksFilter.class);

    private final AppProperties appProperties;
    private final TableStore tableStore;

    public CivilWorksFilter(AppProperties appProperties, TableStore tableStore) {
        this.appProperties = appProperties;
        this.tableStore = tableStore;
    }

    public List<ContractRecord> filter(List<ContractRecord> contracts) {
        List<String> prefixes = appProperties.getScreening().getStrictCpvPrefixes();
        List<ContractRecord> kept = new ArrayList<>();
        for (ContractRecord c : contracts) {
            String code = c.getCpv_code() == null ? "" : c.getCpv_code().trim();
            if (CpvCodes.startsWithAny(code, prefixes)) {
                kept.add(c);
            }
        }
        return kept;
    }

    public PipelineDtos.FilterReport run() {
        Path in = tableStore.resolve(appProperties.getFiles().getIngested());
        Path out = tableStore.resolve(appProperties.getFiles().getStrict());
        List<ContractRecord> contracts = tableStore.readContracts(in);
        log.info("Processing {}: {} rows", in, contracts.size());

        List<ContractRecord> kept = filter(contracts);
        tableStore.writeContracts(out, kept);

        PipelineDtos.FilterReport report = new PipelineDtos.FilterReport();
        report.setInput_rows(contracts.size());
        report.setRetained(kept.size());
        report.setDropped(contracts.size() - kept.size());
        report.setOutput_path(out.toString());
        log.info("Dropped {} rows (buildings/generic/noise), retained {} civil works rows", report.getDropped(), report.getRetained());
        if (kept.isEmpty()) {
            log.warn("No contracts matched the strict CPV prefixes {}", appProperties.getScreening().getStrictCpvPrefixes());
        }
        return report;
    }
}
