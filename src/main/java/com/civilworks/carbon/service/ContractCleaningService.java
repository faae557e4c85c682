package com.civilworks.carbon.service;

import com.civilworks.carbon.config.AppProperties;
import com.civilworks.carbon.dto.PipelineDtos;
import com.civilworks.carbon.model.ContractRecord;
import com.civilworks.carbon.service.enrichment.BuyerCanonicalMap;
import com.civilworks.carbon.service.enrichment.BuyerCanonicalizer;
import com.civilworks.carbon.service.enrichment.SpendParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Prepares the strict civil-works table for screening.
 *
 * <ol>
 *   <li>keeps the original buyer spelling in {@code buyer_name_raw}</li>
 *   <li>rewrites {@code buyer_name} through the canonical buyer map</li>
 *   <li>replaces {@code value_amount} with its parsed number</li>
 *   <li>drops repeated ocids (first kept) and rows whose amount is not positive</li>
 * </ol>
 * The buyer map is written next to the cleaned table and rebuilt from scratch on every run.
 */
@Service
public class ContractCleaningService {
    private static final Logger log = LoggerFactory.getLogger(ContractCleaningService.class);

    private final BuyerCanonicalizer canonicalizer;
    private final AppProperties appProperties;
    private final TableStore tableStore;

    public ContractCleaningService(BuyerCanonicalizer canonicalizer, AppProperties appProperties, TableStore tableStore) {
        this.canonicalizer = canonicalizer;
        this.appProperties = appProperties;
        this.tableStore = tableStore;
    }

    public static class Cleaned {
        public final List<ContractRecord> contracts;
        public final BuyerCanonicalMap buyerMap;
        public final int droppedDuplicates;
        public final int droppedNonPositive;

        Cleaned(List<ContractRecord> contracts, BuyerCanonicalMap buyerMap, int droppedDuplicates, int droppedNonPositive) {
            this.contracts = contracts;
            this.buyerMap = buyerMap;
            this.droppedDuplicates = droppedDuplicates;
            this.droppedNonPositive = droppedNonPositive;
        }
    }

    /** Cleans in memory. Input records are modified in place. */
    public Cleaned clean(List<ContractRecord> contracts) {
        List<String> names = new ArrayList<>(contracts.size());
        for (ContractRecord c : contracts) {
            names.add(c.getBuyer_name());
        }
        BuyerCanonicalMap buyerMap = canonicalizer.canonicalize(names);

        Set<String> seen = new HashSet<>();
        List<ContractRecord> kept = new ArrayList<>();
        int duplicates = 0;
        int nonPositive = 0;
        for (ContractRecord c : contracts) {
            c.setBuyer_name_raw(c.getBuyer_name());
            c.setBuyer_name(buyerMap.canonicalFor(c.getBuyer_name()));

            double amount = SpendParser.parse(c.getValue_amount());
            c.setValue_amount(BigDecimal.valueOf(amount).stripTrailingZeros().toPlainString());

            if (c.getOcid() != null && !seen.add(c.getOcid())) {
                duplicates++;
                continue;
            }
            if (amount <= 0) {
                nonPositive++;
                continue;
            }
            kept.add(c);
        }
        return new Cleaned(kept, buyerMap, duplicates, nonPositive);
    }

    public PipelineDtos.CleaningReport run() {
        Path in = tableStore.resolve(appProperties.getFiles().getStrict());
        List<ContractRecord> contracts = tableStore.readContracts(in);
        Cleaned cleaned = clean(contracts);

        Path out = tableStore.resolve(appProperties.getFiles().getCleaned());
        Path mapOut = tableStore.resolve(appProperties.getFiles().getBuyerMap());
        tableStore.writeContracts(out, cleaned.contracts);
        tableStore.writeRows(mapOut, BuyerCanonicalMap.COLUMNS, cleaned.buyerMap.rows());

        PipelineDtos.CleaningReport report = new PipelineDtos.CleaningReport();
        report.setInput_rows(contracts.size());
        report.setOutput_rows(cleaned.contracts.size());
        report.setDistinct_buyer_names(cleaned.buyerMap.size());
        report.setBuyer_clusters(cleaned.buyerMap.getClusters().size());
        report.setDropped_duplicates(cleaned.droppedDuplicates);
        report.setDropped_non_positive(cleaned.droppedNonPositive);
        report.setOutput_path(out.toString());
        report.setBuyer_map_path(mapOut.toString());
        log.info("Cleaned {} -> {} rows ({} duplicate ids, {} non-positive amounts); {} buyer names in {} clusters",
                report.getInput_rows(), report.getOutput_rows(), report.getDropped_duplicates(),
                report.getDropped_non_positive(), report.getDistinct_buyer_names(), report.getBuyer_clusters());
        return report;
    }
}
