package com.civilworks.carbon.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.civilworks.carbon.config.AppProperties;
import com.civilworks.carbon.dto.IngestDtos;
import com.civilworks.carbon.model.ContractRecord;
import com.civilworks.carbon.service.ingest.CursorStore;
import com.civilworks.carbon.service.ingest.NoticeIngestor;
import com.civilworks.carbon.service.ingest.RetryingFetcher;
import com.civilworks.carbon.service.ingest.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs one ingestion pass and writes the accumulated contracts, whether the run finished or
 * was aborted. Partial output plus the saved cursor is what makes a later resume worthwhile.
 *
 * <p>A resumed run appends to the table left by the previous run; rows whose ocid is already
 * in that table are not written again. A fresh run replaces the table.
 */
@Service
public class IngestService {
    private static final Logger log = LoggerFactory.getLogger(IngestService.class);

    private final RetryingFetcher fetcher;
    private final CursorStore cursorStore;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final Sleeper sleeper;
    private final TableStore tableStore;

    public IngestService(RetryingFetcher fetcher, CursorStore cursorStore, ObjectMapper objectMapper,
                         AppProperties appProperties, Sleeper sleeper, TableStore tableStore) {
        this.fetcher = fetcher;
        this.cursorStore = cursorStore;
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
        this.sleeper = sleeper;
        this.tableStore = tableStore;
    }

    public IngestDtos.IngestReport ingest() {
        NoticeIngestor ingestor = new NoticeIngestor(fetcher, cursorStore, objectMapper, appProperties.getIngest(), sleeper);
        IngestDtos.IngestReport report = ingestor.run();

        List<ContractRecord> records = ingestor.getRecords();
        if (records.isEmpty()) {
            log.warn("No matching contracts found; nothing written");
            return report;
        }
        Path out = tableStore.resolve(appProperties.getFiles().getIngested());
        List<ContractRecord> table = report.isResumed() && Files.isRegularFile(out)
                ? mergeWithPrevious(out, records)
                : records;
        tableStore.writeContracts(out, table);
        report.setOutput_path(out.toString());
        return report;
    }

    private List<ContractRecord> mergeWithPrevious(Path out, List<ContractRecord> records) {
        List<ContractRecord> merged = new ArrayList<>(tableStore.readContracts(out));
        Set<String> known = new HashSet<>();
        for (ContractRecord c : merged) {
            known.add(c.getOcid());
        }
        int appended = 0;
        for (ContractRecord c : records) {
            if (known.add(c.getOcid())) {
                merged.add(c);
                appended++;
            }
        }
        log.info("Resumed run: appended {} contracts to {} saved by the previous run ({} already present)",
                appended, merged.size() - appended, records.size() - appended);
        return merged;
    }
}
